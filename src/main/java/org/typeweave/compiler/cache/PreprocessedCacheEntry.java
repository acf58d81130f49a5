package org.typeweave.compiler.cache;

import org.typeweave.compiler.sourcemap.SourceMap;

/**
 * A cached preprocessing result.
 *
 * @param original    The raw file text.
 * @param code        The preprocessed text, identical to {@code original} when nothing changed.
 * @param map         The source map, null when nothing changed.
 * @param contentHash The hash of {@code original}.
 */
public record PreprocessedCacheEntry(String original, String code, SourceMap map, String contentHash) {

    public boolean changed() {
        return !code.equals(original);
    }
}
