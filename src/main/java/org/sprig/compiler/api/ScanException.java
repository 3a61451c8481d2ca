package org.sprig.compiler.api;

/**
 * Thrown by {@link ScanResult#getOrThrow()} when the result holds a {@link ScanError}.
 */
public class ScanException extends RuntimeException {

    private final ScanError error;

    public ScanException(ScanError error) {
        super(error.message());
        this.error = error;
    }

    public ScanError getError() {
        return error;
    }
}
