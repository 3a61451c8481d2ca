package org.sprig.compiler.frontend.scanner;

import org.sprig.compiler.api.ScanError;
import org.sprig.compiler.api.ScanResult;

/**
 * The Scanner (also known as Lexer or Tokenizer) converts a sequence of characters
 * (source code) into tokens, one token per call to {@link #scanToken()}.
 * <p>
 * Whitespace, comments and the end of input are returned as tokens of their own; the
 * {@link Tokenizer} filters them out. A scanner holds the cursor and position of a single
 * pass and must not be shared between threads.
 */
public class Scanner {

    private final CharCursor cursor;
    private final StringBuilder lexeme = new StringBuilder();
    private Position position = Position.reset();

    /**
     * Creates a new Scanner.
     * @param source The source code as a single string.
     */
    public Scanner(String source) {
        this.cursor = new CharCursor(source);
    }

    /**
     * Returns the position after the last consumed character.
     * @return The current position.
     */
    public Position position() {
        return position;
    }

    /**
     * Consumes the characters of exactly one token. Characters belonging to the next token
     * are only looked at, never consumed.
     *
     * @return The recognized token, or the error that stops the scan pass.
     */
    public ScanResult<Token> scanToken() {
        lexeme.setLength(0);
        int c = advance();
        switch (c) {
            case CharCursor.END: return token(LexemeType.EOF);
            case '(': return token(LexemeType.LEFT_PAREN);
            case ')': return token(LexemeType.RIGHT_PAREN);
            case '{': return token(LexemeType.LEFT_BRACE);
            case '}': return token(LexemeType.RIGHT_BRACE);
            case ',': return token(LexemeType.COMMA);
            case '.': return token(LexemeType.DOT);
            case '-': return token(LexemeType.MINUS);
            case '+': return token(LexemeType.PLUS);
            case ';': return token(LexemeType.SEMICOLON);
            case '*': return token(LexemeType.STAR);
            case '!': return token(match('=') ? LexemeType.BANG_EQUAL : LexemeType.BANG);
            case '=': return token(match('=') ? LexemeType.DOUBLE_EQUAL : LexemeType.EQUAL);
            case '>': return token(match('=') ? LexemeType.GREATER_EQUAL : LexemeType.GREATER);
            case '<': return token(match('=') ? LexemeType.LESS_EQUAL : LexemeType.LESS);
            case '/':
                if (match('/')) {
                    // A comment goes until the end of the line, newline included.
                    int skipped;
                    do {
                        skipped = advance();
                    } while (skipped != '\n' && skipped != CharCursor.END);
                    return token(LexemeType.COMMENT);
                }
                return token(LexemeType.SLASH);
            case '"': return string();
            case ' ', '\r', '\t', '\n': return token(LexemeType.WHITESPACE);
            default:
                if (isDigit(c)) {
                    return number();
                }
                if (isAlpha(c)) {
                    return identifier();
                }
                return ScanResult.failure(ScanError.unknownCharacter(position, lexeme.toString()));
        }
    }

    private ScanResult<Token> string() {
        // The quotes are not part of the value.
        lexeme.setLength(0);
        while (cursor.peek() != '"') {
            if (cursor.isAtEnd()) {
                return ScanResult.failure(ScanError.unterminatedString(position));
            }
            advance();
        }
        String value = lexeme.toString();
        advance(); // The closing "
        return token(new Lexeme.StringLiteral(value));
    }

    private ScanResult<Token> number() {
        boolean fraction = false;
        while (true) {
            int next = cursor.peek();
            if (isDigit(next)) {
                advance();
            } else if (next == '.' && !fraction && isDigit(cursor.peek(1))) {
                // A dot without a digit after it is left for the next token.
                fraction = true;
                advance();
            } else {
                break;
            }
        }
        return token(new Lexeme.NumberLiteral(Double.parseDouble(lexeme.toString())));
    }

    private ScanResult<Token> identifier() {
        while (isAlphaNumeric(cursor.peek())) advance();
        return token(Keywords.classify(lexeme.toString()));
    }

    private int advance() {
        int c = cursor.next();
        if (c != CharCursor.END) {
            lexeme.appendCodePoint(c);
            position = c == '\n' ? position.advanceLine() : position.advanceColumn();
        }
        return c;
    }

    private boolean match(char expected) {
        if (cursor.peek() != expected) {
            return false;
        }
        advance();
        return true;
    }

    private ScanResult<Token> token(LexemeType type) {
        return token(Lexeme.of(type));
    }

    private ScanResult<Token> token(Lexeme value) {
        return ScanResult.success(new Token(value, position));
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(int c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private static boolean isAlphaNumeric(int c) {
        return isAlpha(c) || isDigit(c);
    }
}
