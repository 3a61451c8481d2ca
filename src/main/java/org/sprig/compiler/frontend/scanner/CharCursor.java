package org.sprig.compiler.frontend.scanner;

import java.util.Objects;

/**
 * A forward-only cursor over the code points of a source text with arbitrary lookahead.
 * Peeking never moves the cursor.
 */
public final class CharCursor {

    /** Returned by all read operations past the end of the source. */
    public static final int END = -1;

    private final String source;
    private int offset = 0;

    public CharCursor(String source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public boolean isAtEnd() {
        return offset >= source.length();
    }

    /**
     * Returns the next code point without consuming it.
     * @return The code point, or {@link #END}.
     */
    public int peek() {
        return peek(0);
    }

    /**
     * Looks ahead {@code distance} code points past the next one without consuming anything.
     *
     * @param distance 0 for the next code point, 1 for the one after it, and so on.
     * @return The code point, or {@link #END} if the source is shorter.
     */
    public int peek(int distance) {
        if (distance < 0) {
            throw new IllegalArgumentException("Lookahead distance must not be negative: " + distance);
        }
        int index = offset;
        for (int i = 0; i < distance; i++) {
            if (index >= source.length()) {
                return END;
            }
            index += Character.charCount(source.codePointAt(index));
        }
        return index < source.length() ? source.codePointAt(index) : END;
    }

    /**
     * Consumes and returns the next code point.
     * @return The code point, or {@link #END} if the source is exhausted.
     */
    public int next() {
        if (isAtEnd()) {
            return END;
        }
        int codePoint = source.codePointAt(offset);
        offset += Character.charCount(codePoint);
        return codePoint;
    }
}
