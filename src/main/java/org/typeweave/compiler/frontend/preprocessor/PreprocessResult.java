package org.typeweave.compiler.frontend.preprocessor;

import org.typeweave.compiler.sourcemap.SourceMap;

/**
 * The net output of one preprocessing run.
 *
 * @param code    The rewritten text, identical to the input when nothing changed.
 * @param changed true if the text differs from the input.
 * @param map     The map from {@code code} offsets back to the input, null when unchanged.
 */
public record PreprocessResult(String code, boolean changed, SourceMap map) {

    public static PreprocessResult unchanged(String source) {
        return new PreprocessResult(source, false, null);
    }
}
