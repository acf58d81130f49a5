package org.typeweave.compiler.diagnostics;

/**
 * A single user-visible compiler message attached to a file.
 *
 * @param severity The severity of the message.
 * @param message  The human-readable text.
 * @param fileName The file the message refers to.
 * @param start    The start offset in the file, or -1 if the message is file-level.
 * @param length   The length of the offending region, 0 if unknown.
 * @param phase    The pipeline phase that produced the message (e.g. "preprocess", "macro").
 */
public record Diagnostic(Severity severity, String message, String fileName, int start, int length, String phase) {

    /**
     * Diagnostic severity levels.
     */
    public enum Severity {
        ERROR,
        WARNING,
        INFO
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        String position = start >= 0 ? ":" + start : "";
        return String.format("[%s] %s%s (%s): %s", severity, fileName, position, phase, message);
    }
}
