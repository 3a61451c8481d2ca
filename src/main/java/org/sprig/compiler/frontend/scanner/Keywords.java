package org.sprig.compiler.frontend.scanner;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Classifies scanned words as reserved keywords or identifiers.
 */
public final class Keywords {

    private static final Map<String, Lexeme> KEYWORDS;

    static {
        Map<String, Lexeme> keywords = new HashMap<>();
        for (LexemeType type : LexemeType.values()) {
            if (type.isKeyword()) {
                keywords.put(type.spelling(), Lexeme.of(type));
            }
        }
        KEYWORDS = Collections.unmodifiableMap(keywords);
    }

    private Keywords() {}

    /**
     * Classifies a complete word. Matching is exact and case-sensitive, so {@code "While"}
     * and {@code "whiles"} are identifiers.
     *
     * @param text The word as accumulated by the scanner.
     * @return The keyword lexeme, or an {@link Lexeme.Identifier} carrying {@code text}.
     */
    public static Lexeme classify(String text) {
        Lexeme keyword = KEYWORDS.get(text);
        return keyword != null ? keyword : new Lexeme.Identifier(text);
    }

    public static boolean isKeyword(String text) {
        return KEYWORDS.containsKey(text);
    }

    /**
     * @return The spellings of all reserved words.
     */
    public static Set<String> spellings() {
        return KEYWORDS.keySet();
    }
}
