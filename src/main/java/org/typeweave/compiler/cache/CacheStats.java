package org.typeweave.compiler.cache;

/**
 * A snapshot of cache counters.
 *
 * @param preprocessedCount Entries in the preprocessed tier.
 * @param transformedCount  Entries in the transformed tier.
 * @param maxSize           The bound of the transformed tier.
 * @param hits              Valid transformed-tier lookups.
 * @param misses            Transformed-tier lookups that found no valid entry.
 * @param evictions         Transformed entries evicted by the LRU bound.
 */
public record CacheStats(int preprocessedCount, int transformedCount, int maxSize,
                         long hits, long misses, long evictions) {

    @Override
    public String toString() {
        return String.format("preprocessed=%d transformed=%d/%d hits=%d misses=%d evictions=%d",
                preprocessedCount, transformedCount, maxSize, hits, misses, evictions);
    }
}
