package org.sprig.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can abort a scan pass.
 * This decouples the test logic from the error messages.
 */
public enum ScanErrorCode {
    /** A character that starts no token was consumed. */
    UNKNOWN_CHARACTER,
    /** The source ended before the closing quote of a string literal. */
    UNTERMINATED_STRING
}
