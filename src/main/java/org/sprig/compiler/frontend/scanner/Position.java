package org.sprig.compiler.frontend.scanner;

/**
 * A 1-based line/column location in the source text.
 * <p>
 * Positions are immutable. The {@link Scanner} replaces its current position on every
 * consumed character, so a position captured in a {@link Token} never changes afterwards.
 *
 * @param line The line number, starting at 1.
 * @param column The column number, starting at 1.
 */
public record Position(int line, int column) {

    private static final Position START = new Position(1, 1);

    public Position {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Position must be 1-based, got " + line + ":" + column);
        }
    }

    /**
     * Returns the position at the very beginning of a source text.
     * @return The position {@code 1:1}.
     */
    public static Position reset() {
        return START;
    }

    /**
     * Returns the position one column further on the same line.
     * @return The advanced position.
     */
    public Position advanceColumn() {
        return new Position(line, column + 1);
    }

    /**
     * Returns the first column of the following line.
     * @return The advanced position.
     */
    public Position advanceLine() {
        return new Position(line + 1, 1);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
