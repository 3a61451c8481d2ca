package org.sprig.compiler.frontend.scanner;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The classified category of a token, together with its value where the category has one.
 * <p>
 * The set of variants is closed: payload-free kinds share {@link Fixed}, and each payload
 * kind has its own record. Dispatch is done with a {@code switch} over {@link #type()}.
 */
public sealed interface Lexeme permits Lexeme.Fixed, Lexeme.Identifier, Lexeme.StringLiteral, Lexeme.NumberLiteral {

    /**
     * Returns the type of this lexeme.
     * @return The lexeme type, never {@code null}.
     */
    LexemeType type();

    /**
     * Returns the shared instance for a payload-free lexeme type.
     *
     * @param type A type for which {@link LexemeType#hasPayload()} is {@code false}.
     * @return The lexeme for that type.
     * @throws IllegalArgumentException if the type carries a payload.
     */
    static Lexeme of(LexemeType type) {
        Fixed fixed = Fixed.CACHE.get(type);
        if (fixed == null) {
            throw new IllegalArgumentException("Lexeme type " + type + " requires a payload");
        }
        return fixed;
    }

    /**
     * A punctuation, operator, keyword or internal lexeme.
     * @param type The lexeme type.
     */
    record Fixed(LexemeType type) implements Lexeme {

        private static final Map<LexemeType, Fixed> CACHE = new EnumMap<>(LexemeType.class);

        static {
            for (LexemeType type : LexemeType.values()) {
                if (!type.hasPayload()) {
                    CACHE.put(type, new Fixed(type));
                }
            }
        }

        public Fixed {
            Objects.requireNonNull(type, "type");
            if (type.hasPayload()) {
                throw new IllegalArgumentException("Lexeme type " + type + " requires a payload");
            }
        }

        @Override
        public String toString() {
            return type.name();
        }
    }

    /**
     * A name that is not a reserved keyword.
     * @param name The matched characters.
     */
    record Identifier(String name) implements Lexeme {

        public Identifier {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public LexemeType type() {
            return LexemeType.IDENTIFIER;
        }

        @Override
        public String toString() {
            return "Identifier(" + name + ")";
        }
    }

    /**
     * A string literal.
     * @param value The characters between the delimiting quotes.
     */
    record StringLiteral(String value) implements Lexeme {

        public StringLiteral {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public LexemeType type() {
            return LexemeType.STRING_LITERAL;
        }

        @Override
        public String toString() {
            return "StringLiteral(\"" + value + "\")";
        }
    }

    /**
     * A number literal.
     * @param value The parsed value.
     */
    record NumberLiteral(double value) implements Lexeme {

        @Override
        public LexemeType type() {
            return LexemeType.NUMBER_LITERAL;
        }

        @Override
        public String toString() {
            return "NumberLiteral(" + value + ")";
        }
    }
}
