package org.sprig.compiler.frontend.scanner;

import java.util.Objects;

/**
 * Represents a single token extracted from the source code by the {@link Scanner}.
 *
 * @param lexeme The classified lexeme, including its value where it has one.
 * @param position The scanner position at the time the token was completed.
 */
public record Token(Lexeme lexeme, Position position) {

    public Token {
        Objects.requireNonNull(lexeme, "lexeme");
        Objects.requireNonNull(position, "position");
    }

    /**
     * Shortcut for {@code lexeme().type()}.
     * @return The lexeme type.
     */
    public LexemeType type() {
        return lexeme.type();
    }

    @Override
    public String toString() {
        return lexeme + "@" + position;
    }
}
