package org.typeweave.compiler.host;

import org.typeweave.compiler.diagnostics.Diagnostic;
import org.typeweave.compiler.sourcemap.SourceMap;

import java.util.List;

/**
 * A source file as handed to the type checker.
 *
 * @param fileName         The canonical file name.
 * @param text             The text the type checker sees.
 * @param preprocessed     true if {@code text} is rewritten output rather than the file content.
 * @param parseDiagnostics Syntax errors found in {@code text}.
 * @param map              Maps {@code text} offsets back to the file content, null when not preprocessed.
 */
public record SourceFile(String fileName, String text, boolean preprocessed, List<Diagnostic> parseDiagnostics,
                         SourceMap map) {

    public SourceFile {
        parseDiagnostics = parseDiagnostics == null ? List.of() : List.copyOf(parseDiagnostics);
    }

    public static SourceFile plain(String fileName, String text) {
        return new SourceFile(fileName, text, false, List.of(), null);
    }

    public boolean hasParseErrors() {
        return parseDiagnostics.stream().anyMatch(Diagnostic::isError);
    }
}
