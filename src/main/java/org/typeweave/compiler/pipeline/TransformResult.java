package org.typeweave.compiler.pipeline;

import org.typeweave.compiler.diagnostics.Diagnostic;
import org.typeweave.compiler.sourcemap.SourceMap;

import java.util.List;
import java.util.Set;

/**
 * The outcome of transforming one file.
 *
 * @param fileName     The canonical file name.
 * @param original     The file content.
 * @param code         The fully transformed text.
 * @param map          Maps {@code code} offsets to {@code original} offsets, null when unchanged.
 * @param changed      true if {@code code} differs from {@code original}.
 * @param diagnostics  Parse and macro diagnostics, positioned in {@code original}.
 * @param dependencies The canonical names of the files this file imports.
 */
public record TransformResult(String fileName, String original, String code, SourceMap map, boolean changed,
                              List<Diagnostic> diagnostics, Set<String> dependencies) {

    public TransformResult {
        diagnostics = List.copyOf(diagnostics);
        dependencies = Set.copyOf(dependencies);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }
}
