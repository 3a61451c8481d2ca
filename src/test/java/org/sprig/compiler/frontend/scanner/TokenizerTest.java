package org.sprig.compiler.frontend.scanner;

import org.sprig.compiler.api.ScanError;
import org.sprig.compiler.api.ScanErrorCode;
import org.sprig.compiler.api.ScanException;
import org.sprig.compiler.api.ScanResult;
import org.sprig.compiler.diagnostics.DiagnosticsEngine;
import org.sprig.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for complete scan passes through the {@link Tokenizer}.
 * The log watcher makes sure a pass never logs above DEBUG, even when it fails.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class TokenizerTest {

    private static List<Token> tokens(String source) {
        ScanResult<List<Token>> result = Tokenizer.tokenize(source);
        assertThat(result.isSuccess()).as("scan of %s", source).isTrue();
        return result.getOrThrow();
    }

    private static List<Lexeme> lexemes(String source) {
        return tokens(source).stream().map(Token::lexeme).toList();
    }

    private static ScanError error(String source) {
        ScanResult<List<Token>> result = Tokenizer.tokenize(source);
        assertThat(result.isSuccess()).as("scan of %s", source).isFalse();
        return result.failure().orElseThrow();
    }

    /**
     * Verifies a small declaration, including the positions of each token.
     */
    @Test
    void scansDeclaration() {
        // Act
        List<Token> tokens = tokens("let x = 12.5;");

        // Assert
        assertThat(tokens).extracting(Token::lexeme).containsExactly(
                Lexeme.of(LexemeType.LET),
                new Lexeme.Identifier("x"),
                Lexeme.of(LexemeType.EQUAL),
                new Lexeme.NumberLiteral(12.5),
                Lexeme.of(LexemeType.SEMICOLON));
        assertThat(tokens).extracting(Token::position).containsExactly(
                new Position(1, 4), new Position(1, 6), new Position(1, 8), new Position(1, 13), new Position(1, 14));
    }

    @Test
    void commentAndItsNewlineAreDiscarded() {
        List<Token> tokens = tokens("// comment\nlet");

        assertThat(tokens).extracting(Token::lexeme).containsExactly(Lexeme.of(LexemeType.LET));
        assertThat(tokens.get(0).position()).isEqualTo(new Position(2, 4));
    }

    @Test
    void operatorsWithoutSpaces() {
        assertThat(lexemes("a<=b")).containsExactly(
                new Lexeme.Identifier("a"), Lexeme.of(LexemeType.LESS_EQUAL), new Lexeme.Identifier("b"));
    }

    @Test
    void internalTokensNeverReachCaller() {
        List<Token> tokens = tokens("  \t// only a comment\n\r\n  ");

        assertThat(tokens).isEmpty();
    }

    @Test
    void punctuationYieldsOneTokenPerCharacterInOrder() {
        // Arrange
        String source = "( ) { } , . - + ; * / ! = > <";
        long nonWhitespace = source.chars().filter(c -> c != ' ').count();

        // Act
        List<Token> tokens = tokens(source);

        // Assert
        assertThat(tokens).hasSize((int) nonWhitespace);
        assertThat(tokens).extracting(token -> token.type().spelling())
                .containsExactly(source.split(" "));
    }

    @ParameterizedTest
    @ValueSource(strings = {"and", "class", "else", "false", "for", "func", "if", "let", "nil",
            "or", "print", "return", "super", "this", "true", "while"})
    void keywordSpellingYieldsKeyword(String keyword) {
        List<Token> tokens = tokens(keyword);

        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).type().isKeyword()).isTrue();
        assertThat(tokens.get(0).type().spelling()).isEqualTo(keyword);
    }

    @ParameterizedTest
    @ValueSource(strings = {"and", "class", "else", "false", "for", "func", "if", "let", "nil",
            "or", "print", "return", "super", "this", "true", "while"})
    void keywordWithExtraLetterIsIdentifier(String keyword) {
        String word = keyword + "s";

        assertThat(lexemes(word)).containsExactly(new Lexeme.Identifier(word));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "7", "42", "1234567890", "0.5", "3.25", "10.0", "007.100"})
    void decimalTextYieldsItsValue(String text) {
        assertThat(lexemes(text)).containsExactly(new Lexeme.NumberLiteral(Double.parseDouble(text)));
    }

    @Test
    void trailingDotIsSeparateToken() {
        assertThat(lexemes("12.")).containsExactly(new Lexeme.NumberLiteral(12), Lexeme.of(LexemeType.DOT));
    }

    @Test
    void stringLiteralPayloadHasNoQuotes() {
        assertThat(lexemes("\"abc\"")).containsExactly(new Lexeme.StringLiteral("abc"));
    }

    @Test
    void positionsNeverDecrease() {
        // Arrange
        String source = String.join("\n",
                "class Greeter {",
                "  func greet(name) {",
                "    // say hello",
                "    print \"Hello, \" + name;",
                "    return nil;",
                "  }",
                "}");

        // Act
        List<Token> tokens = tokens(source);

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                LexemeType.CLASS, LexemeType.IDENTIFIER, LexemeType.LEFT_BRACE,
                LexemeType.FUNC, LexemeType.IDENTIFIER, LexemeType.LEFT_PAREN, LexemeType.IDENTIFIER,
                LexemeType.RIGHT_PAREN, LexemeType.LEFT_BRACE,
                LexemeType.PRINT, LexemeType.STRING_LITERAL, LexemeType.PLUS, LexemeType.IDENTIFIER, LexemeType.SEMICOLON,
                LexemeType.RETURN, LexemeType.NIL, LexemeType.SEMICOLON,
                LexemeType.RIGHT_BRACE,
                LexemeType.RIGHT_BRACE);
        for (int i = 1; i < tokens.size(); i++) {
            Position previous = tokens.get(i - 1).position();
            Position current = tokens.get(i).position();
            assertThat(current.line() > previous.line()
                    || (current.line() == previous.line() && current.column() >= previous.column()))
                    .as("%s after %s", current, previous)
                    .isTrue();
        }
        assertThat(tokens.get(tokens.size() - 1).position()).isEqualTo(new Position(7, 2));
    }

    @Test
    void unknownCharacterAbortsWholePass() {
        ScanError error = error("let a = 1; @ let b = 2; #");

        assertThat(error.code()).isEqualTo(ScanErrorCode.UNKNOWN_CHARACTER);
        assertThat(error.text()).isEqualTo("@");
        assertThat(error.position()).isEqualTo(new Position(1, 13));
    }

    @Test
    void hashIsUnknown() {
        ScanError error = error("x = #");

        assertThat(error.code()).isEqualTo(ScanErrorCode.UNKNOWN_CHARACTER);
        assertThat(error.text()).isEqualTo("#");
        assertThat(error.position()).isEqualTo(new Position(1, 6));
    }

    @Test
    void unterminatedStringAbortsPass() {
        ScanError error = error("print \"oops;\n");

        assertThat(error.code()).isEqualTo(ScanErrorCode.UNTERMINATED_STRING);
        assertThat(error.position()).isEqualTo(new Position(2, 1));
    }

    @Test
    void resultListIsUnmodifiable() {
        List<Token> tokens = tokens("x");

        assertThatThrownBy(() -> tokens.add(tokens.get(0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void getOrThrowCarriesTheError() {
        ScanResult<List<Token>> result = Tokenizer.tokenize("@");

        assertThatThrownBy(result::getOrThrow)
                .isInstanceOf(ScanException.class)
                .hasMessage("Unknown character '@' at line 1, column 2")
                .extracting(e -> ((ScanException) e).getError().code())
                .isEqualTo(ScanErrorCode.UNKNOWN_CHARACTER);
    }

    @Test
    void tokenizeToStreamWrapsTokens() {
        TokenStream stream = Tokenizer.tokenizeToStream("a + b").getOrThrow();

        assertThat(stream.size()).isEqualTo(3);
        assertThat(stream.next().lexeme()).isEqualTo(new Lexeme.Identifier("a"));
    }

    @Test
    void tokenizeToStreamPassesErrorOn() {
        ScanResult<TokenStream> result = Tokenizer.tokenizeToStream("a ? b");

        assertThat(result.failure()).map(ScanError::text).contains("?");
    }

    /**
     * Verifies that a failed pass is reported to the diagnostics engine with the configured
     * source name, and that no tokens are returned.
     */
    @Test
    void failureIsReportedToDiagnostics() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        ScannerOptions options = new ScannerOptions("main.sprig");

        // Act
        List<Token> tokens = Tokenizer.tokenize("let @", diagnostics, options);

        // Assert
        assertThat(tokens).isEmpty();
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.summary())
                .isEqualTo("[ERROR] main.sprig:1:6: Unknown character '@' at line 1, column 6");
    }

    @Test
    void successLeavesDiagnosticsEmpty() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = Tokenizer.tokenize("print 1;", diagnostics, ScannerOptions.defaults());

        assertThat(tokens).hasSize(3);
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }
}
