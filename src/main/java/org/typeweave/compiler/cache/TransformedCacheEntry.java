package org.typeweave.compiler.cache;

import org.typeweave.compiler.pipeline.TransformResult;

import java.util.Map;
import java.util.Set;

/**
 * A cached transformation result together with the dependency hashes it was computed against.
 *
 * @param result           The transformation result.
 * @param contentHash      The hash of the file's own text.
 * @param dependencies     The files the transformation depended on.
 * @param dependencyHashes The hash of each dependency at write time.
 */
public record TransformedCacheEntry(TransformResult result, String contentHash, Set<String> dependencies,
                                    Map<String, String> dependencyHashes) {

    public TransformedCacheEntry {
        dependencies = Set.copyOf(dependencies);
        dependencyHashes = Map.copyOf(dependencyHashes);
    }
}
