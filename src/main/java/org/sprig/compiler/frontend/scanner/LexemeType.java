package org.sprig.compiler.frontend.scanner;

/**
 * Defines every kind of lexeme the {@link Scanner} can recognize.
 */
public enum LexemeType {
    // Single-character tokens.
    /** The '(' character. */
    LEFT_PAREN(Category.PUNCTUATION, "("),
    /** The ')' character. */
    RIGHT_PAREN(Category.PUNCTUATION, ")"),
    /** The '{' character. */
    LEFT_BRACE(Category.PUNCTUATION, "{"),
    /** The '}' character. */
    RIGHT_BRACE(Category.PUNCTUATION, "}"),
    /** The ',' character. */
    COMMA(Category.PUNCTUATION, ","),
    /** The '.' character, used for member access. */
    DOT(Category.PUNCTUATION, "."),
    /** The '-' character. */
    MINUS(Category.PUNCTUATION, "-"),
    /** The '+' character. */
    PLUS(Category.PUNCTUATION, "+"),
    /** The ';' character, terminating statements. */
    SEMICOLON(Category.PUNCTUATION, ";"),
    /** The '/' character when it does not start a comment. */
    SLASH(Category.PUNCTUATION, "/"),
    /** The '*' character. */
    STAR(Category.PUNCTUATION, "*"),

    // One or two character tokens.
    BANG(Category.OPERATOR, "!"),
    BANG_EQUAL(Category.OPERATOR, "!="),
    EQUAL(Category.OPERATOR, "="),
    DOUBLE_EQUAL(Category.OPERATOR, "=="),
    GREATER(Category.OPERATOR, ">"),
    GREATER_EQUAL(Category.OPERATOR, ">="),
    LESS(Category.OPERATOR, "<"),
    LESS_EQUAL(Category.OPERATOR, "<="),

    // Literals.
    /** A name that is not a reserved word. Carries the name. */
    IDENTIFIER(Category.IDENTIFIER, null),
    /** A double-quoted string. Carries the text between the quotes. */
    STRING_LITERAL(Category.LITERAL, null),
    /** A decimal number. Carries its floating-point value. */
    NUMBER_LITERAL(Category.LITERAL, null),

    // Keywords.
    AND(Category.KEYWORD, "and"),
    CLASS(Category.KEYWORD, "class"),
    ELSE(Category.KEYWORD, "else"),
    FALSE(Category.KEYWORD, "false"),
    FOR(Category.KEYWORD, "for"),
    FUNC(Category.KEYWORD, "func"),
    IF(Category.KEYWORD, "if"),
    LET(Category.KEYWORD, "let"),
    NIL(Category.KEYWORD, "nil"),
    OR(Category.KEYWORD, "or"),
    PRINT(Category.KEYWORD, "print"),
    RETURN(Category.KEYWORD, "return"),
    SUPER(Category.KEYWORD, "super"),
    THIS(Category.KEYWORD, "this"),
    TRUE(Category.KEYWORD, "true"),
    WHILE(Category.KEYWORD, "while"),

    // Produced by the scanner but dropped by the tokenizer.
    /** A line comment, including its terminating newline. */
    COMMENT(Category.INTERNAL, null),
    /** A single whitespace character. */
    WHITESPACE(Category.INTERNAL, null),
    /** Represents the end of the source text. */
    EOF(Category.INTERNAL, null);

    /**
     * Broad grouping of lexeme types.
     */
    public enum Category {
        PUNCTUATION,
        OPERATOR,
        LITERAL,
        IDENTIFIER,
        KEYWORD,
        /** Never returned from a completed scan pass. */
        INTERNAL
    }

    private final Category category;
    private final String spelling;

    LexemeType(Category category, String spelling) {
        this.category = category;
        this.spelling = spelling;
    }

    public Category category() {
        return category;
    }

    /**
     * Returns the fixed source spelling of this type, e.g. {@code "<="} or {@code "while"}.
     * @return The spelling, or {@code null} for literals, identifiers and internal types.
     */
    public String spelling() {
        return spelling;
    }

    public boolean isKeyword() {
        return category == Category.KEYWORD;
    }

    public boolean isInternal() {
        return category == Category.INTERNAL;
    }

    /**
     * Checks whether lexemes of this type carry a value.
     * @return {@code true} for identifiers, string literals and number literals.
     */
    public boolean hasPayload() {
        return this == IDENTIFIER || this == STRING_LITERAL || this == NUMBER_LITERAL;
    }
}
