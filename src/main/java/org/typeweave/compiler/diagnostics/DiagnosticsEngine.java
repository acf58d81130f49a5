package org.typeweave.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects diagnostics produced while processing one or more files.
 * Errors never abort processing; callers inspect {@link #hasErrors()} afterwards.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error for a region of a file.
     * @param message  The message.
     * @param fileName The file name.
     * @param start    The start offset, or -1 for a file-level error.
     * @param length   The length of the region.
     * @param phase    The reporting phase.
     */
    public void reportError(String message, String fileName, int start, int length, String phase) {
        report(new Diagnostic(Diagnostic.Severity.ERROR, message, fileName, start, length, phase));
    }

    /**
     * Reports a warning for a region of a file.
     * @param message  The message.
     * @param fileName The file name.
     * @param start    The start offset, or -1 for a file-level warning.
     * @param length   The length of the region.
     * @param phase    The reporting phase.
     */
    public void reportWarning(String message, String fileName, int start, int length, String phase) {
        report(new Diagnostic(Diagnostic.Severity.WARNING, message, fileName, start, length, phase));
    }

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void reportAll(List<Diagnostic> other) {
        diagnostics.addAll(other);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    /**
     * @return An unmodifiable view of all diagnostics in report order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns the diagnostics attached to one file.
     * @param fileName The file name.
     * @return The diagnostics for that file in report order.
     */
    public List<Diagnostic> forFile(String fileName) {
        return diagnostics.stream().filter(d -> d.fileName().equals(fileName)).toList();
    }

    /**
     * @return A multi-line summary of all diagnostics, one per line.
     */
    public String summary() {
        return diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
    }
}
