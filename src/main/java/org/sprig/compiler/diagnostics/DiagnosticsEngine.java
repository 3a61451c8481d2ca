package org.sprig.compiler.diagnostics;

import org.sprig.compiler.api.ScanError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages (errors, warnings) for callers that prefer
 * reporting over the {@link org.sprig.compiler.api.ScanResult} values of the scanner.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message      The error message.
     * @param fileName     The source in which the error occurred.
     * @param lineNumber   The line number of the error.
     * @param columnNumber The column number of the error.
     */
    public void reportError(String message, String fileName, int lineNumber, int columnNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, fileName, lineNumber, columnNumber));
    }

    /**
     * Reports a scan error at its own position.
     *
     * @param error    The error of a failed scan pass.
     * @param fileName The source in which the error occurred.
     */
    public void reportError(ScanError error, String fileName) {
        reportError(error.message(), fileName, error.position().line(), error.position().column());
    }

    /**
     * Reports a warning.
     *
     * @param message      The warning message.
     * @param fileName     The source in which the warning occurred.
     * @param lineNumber   The line number of the warning.
     * @param columnNumber The column number of the warning.
     */
    public void reportWarning(String message, String fileName, int lineNumber, int columnNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, fileName, lineNumber, columnNumber));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
