package org.typeweave.compiler.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Two-tier incremental cache for one build session.
 * <p>
 * The preprocessed tier maps raw text to syntactically valid text and is validated by content hash only.
 * The transformed tier holds fully expanded results and is additionally validated against the recorded
 * hash of every dependency. The transformed tier is bounded by entry count and evicts the least recently
 * used entry; reads and writes both count as access. Eviction leaves the dependency graph intact, so
 * invalidation still reaches dependents cached behind an evicted file.
 * <p>
 * Instances are not thread-safe. Callers that share one across threads must synchronize externally.
 */
public class TransformCache {

    private static final Logger log = LoggerFactory.getLogger(TransformCache.class);

    public static final int DEFAULT_MAX_SIZE = 1000;

    private final int maxSize;
    private final Map<String, PreprocessedCacheEntry> preprocessed = new HashMap<>();
    private final LinkedHashMap<String, TransformedCacheEntry> transformed;
    private final DependencyGraph graph = new DependencyGraph();

    private long hits;
    private long misses;
    private long evictions;

    public TransformCache() {
        this(DEFAULT_MAX_SIZE);
    }

    /**
     * @param maxSize The maximum number of transformed entries, at least 1.
     */
    public TransformCache(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1: " + maxSize);
        }
        this.maxSize = maxSize;
        this.transformed = new LinkedHashMap<>(16, 0.75f, true);
    }

    // Preprocessed tier

    public PreprocessedCacheEntry getPreprocessed(String fileName) {
        return preprocessed.get(fileName);
    }

    public void setPreprocessed(String fileName, PreprocessedCacheEntry entry) {
        preprocessed.put(fileName, entry);
    }

    /**
     * @return true if a preprocessed entry exists for the file and was computed from the given content.
     */
    public boolean isPreprocessedValid(String fileName, String currentContentHash) {
        PreprocessedCacheEntry entry = preprocessed.get(fileName);
        return entry != null && entry.contentHash().equals(currentContentHash);
    }

    public void removePreprocessed(String fileName) {
        preprocessed.remove(fileName);
    }

    public Set<String> getPreprocessedFileNames() {
        return Set.copyOf(preprocessed.keySet());
    }

    // Transformed tier

    /**
     * Reads a transformed entry and marks it as recently used.
     * @return The entry, or null.
     */
    public TransformedCacheEntry getTransformed(String fileName) {
        return transformed.get(fileName);
    }

    /**
     * Stores a transformed entry, records its dependency edges and enforces the size bound.
     */
    public void setTransformed(String fileName, TransformedCacheEntry entry) {
        transformed.put(fileName, entry);
        graph.setDependencies(fileName, entry.dependencies());
        evictIfNeeded();
    }

    /**
     * Checks whether the cached transformation of a file is still valid. A dependency whose current hash
     * cannot be resolved invalidates the entry.
     * @param fileName           The file.
     * @param currentContentHash The hash of the file's current text.
     * @param hashLookup         Resolves the current hash of a dependency, returning null if unknown.
     * @return true if the entry can be reused.
     */
    public boolean isTransformedValid(String fileName, String currentContentHash,
                                      Function<String, String> hashLookup) {
        TransformedCacheEntry entry = transformed.get(fileName);
        if (entry == null || !entry.contentHash().equals(currentContentHash)) {
            misses++;
            return false;
        }
        for (Map.Entry<String, String> dependency : entry.dependencyHashes().entrySet()) {
            String current = hashLookup.apply(dependency.getKey());
            if (current == null || !current.equals(dependency.getValue())) {
                log.debug("Cached transform of {} is stale: dependency {} changed", fileName, dependency.getKey());
                misses++;
                return false;
            }
        }
        hits++;
        return true;
    }

    // Invalidation

    /**
     * Drops both tiers for a file and the transformed entries of all its transitive dependents.
     * @param fileName The file.
     * @return The names of the dependents whose transformed entries were dropped.
     */
    public Set<String> invalidate(String fileName) {
        preprocessed.remove(fileName);
        transformed.remove(fileName);
        Set<String> dependents = graph.getTransitiveDependents(fileName);
        for (String dependent : dependents) {
            transformed.remove(dependent);
        }
        if (!dependents.isEmpty()) {
            log.debug("Invalidated {} and {} dependent(s)", fileName, dependents.size());
        }
        return dependents;
    }

    public void invalidateMany(Iterable<String> fileNames) {
        for (String fileName : fileNames) {
            invalidate(fileName);
        }
    }

    /**
     * Resets both tiers, the dependency graph and the counters.
     */
    public void clear() {
        preprocessed.clear();
        transformed.clear();
        graph.clear();
        hits = 0;
        misses = 0;
        evictions = 0;
    }

    // Dependency tracking

    public void updateDependencies(String fileName, Set<String> dependencies) {
        graph.setDependencies(fileName, dependencies);
    }

    public Set<String> getDependents(String fileName) {
        return graph.getDependents(fileName);
    }

    public Set<String> getTransitiveDependents(String fileName) {
        return graph.getTransitiveDependents(fileName);
    }

    public DependencyGraph getDependencyGraph() {
        return graph;
    }

    public CacheStats getStats() {
        return new CacheStats(preprocessed.size(), transformed.size(), maxSize, hits, misses, evictions);
    }

    /**
     * @return The transformed entries' file names, least recently used first.
     */
    public List<String> getTransformedFileNames() {
        return new ArrayList<>(transformed.keySet());
    }

    private void evictIfNeeded() {
        Iterator<Map.Entry<String, TransformedCacheEntry>> it = transformed.entrySet().iterator();
        while (transformed.size() > maxSize && it.hasNext()) {
            String eldest = it.next().getKey();
            it.remove();
            evictions++;
            log.debug("Evicted transformed entry for {}", eldest);
        }
    }
}
