package org.typeweave.compiler.macro;

import org.typeweave.compiler.diagnostics.Diagnostic;
import org.typeweave.compiler.sourcemap.SourceMap;

import java.util.List;

/**
 * The outcome of expanding the macros of one file.
 *
 * @param code        The expanded text.
 * @param changed     true if at least one call was expanded.
 * @param map         Maps {@code code} back to the input text, null when unchanged.
 * @param diagnostics Errors and warnings, positioned in the input text.
 * @param expansions  The number of expanded calls.
 */
public record ExpansionResult(String code, boolean changed, SourceMap map, List<Diagnostic> diagnostics,
                              int expansions) {

    public ExpansionResult {
        diagnostics = List.copyOf(diagnostics);
    }
}
