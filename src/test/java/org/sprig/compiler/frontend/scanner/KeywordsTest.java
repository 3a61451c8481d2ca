package org.sprig.compiler.frontend.scanner;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the keyword table of {@link Keywords}.
 */
@Tag("unit")
class KeywordsTest {

    @Test
    void everyKeywordClassifiesToItsOwnType() {
        for (LexemeType type : LexemeType.values()) {
            if (type.isKeyword()) {
                assertThat(Keywords.classify(type.spelling())).isEqualTo(Lexeme.of(type));
            }
        }
    }

    @Test
    void tableContainsExactlyTheReservedWords() {
        assertThat(Keywords.spellings()).containsExactlyInAnyOrder(
                "and", "class", "else", "false", "for", "func", "if", "let", "nil",
                "or", "print", "return", "super", "this", "true", "while");
    }

    /**
     * Words that share a first letter with a keyword must not be mistaken for it.
     */
    @Test
    void wordsSharingPrefixesAreIdentifiers() {
        for (String word : new String[] {"o", "l", "lf", "ohile", "phile", "rhile", "shile", "f", "fo", "t", "th", "whil"}) {
            assertThat(Keywords.classify(word)).isEqualTo(new Lexeme.Identifier(word));
        }
    }

    @Test
    void matchingIsCaseSensitive() {
        assertThat(Keywords.classify("While")).isEqualTo(new Lexeme.Identifier("While"));
        assertThat(Keywords.isKeyword("NIL")).isFalse();
        assertThat(Keywords.isKeyword("nil")).isTrue();
    }
}
