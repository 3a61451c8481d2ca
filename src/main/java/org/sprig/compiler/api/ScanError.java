package org.sprig.compiler.api;

import org.sprig.compiler.frontend.scanner.Position;

import java.util.Objects;

/**
 * The error value produced when a scan pass fails.
 *
 * @param code The kind of failure.
 * @param position The scanner position at the time of the failure.
 * @param text The source text that triggered it: the unknown character, or the opening quote
 *             of an unterminated string.
 */
public record ScanError(ScanErrorCode code, Position position, String text) {

    public ScanError {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(text, "text");
    }

    public static ScanError unknownCharacter(Position position, String text) {
        return new ScanError(ScanErrorCode.UNKNOWN_CHARACTER, position, text);
    }

    public static ScanError unterminatedString(Position position) {
        return new ScanError(ScanErrorCode.UNTERMINATED_STRING, position, "\"");
    }

    /**
     * Renders a human-readable description of this error.
     * @return For example {@code Unknown character '@' at line 1, column 6}.
     */
    public String message() {
        String what = switch (code) {
            case UNKNOWN_CHARACTER -> "Unknown character '" + text + "'";
            case UNTERMINATED_STRING -> "Unterminated string";
        };
        return what + " at line " + position.line() + ", column " + position.column();
    }

    @Override
    public String toString() {
        return "[" + code + "] " + message();
    }
}
