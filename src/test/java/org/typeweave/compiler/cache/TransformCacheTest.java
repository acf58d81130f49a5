package org.typeweave.compiler.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.typeweave.compiler.pipeline.TransformResult;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests validation, invalidation cascades and LRU bounding of the two-tier transform cache.
 */
public class TransformCacheTest {

    private TransformCache cache;
    private Map<String, String> currentHashes;

    @BeforeEach
    void setUp() {
        cache = new TransformCache(10);
        currentHashes = new HashMap<>();
    }

    private TransformedCacheEntry entry(String file, Set<String> dependencies) {
        String content = "content of " + file;
        currentHashes.put(file, ContentHasher.hash(content));
        Map<String, String> dependencyHashes = new HashMap<>();
        for (String dependency : dependencies) {
            dependencyHashes.put(dependency, currentHashes.getOrDefault(dependency, ContentHasher.hash("content of " + dependency)));
        }
        TransformResult result = new TransformResult(file, content, content, null, false, List.of(), dependencies);
        return new TransformedCacheEntry(result, ContentHasher.hash(content), dependencies, dependencyHashes);
    }

    private boolean valid(String file) {
        return cache.isTransformedValid(file, currentHashes.get(file), currentHashes::get);
    }

    @Test
    @Tag("unit")
    void entryIsValidUntilItsOwnContentChanges() {
        cache.setTransformed("a", entry("a", Set.of()));

        assertThat(valid("a")).isTrue();

        currentHashes.put("a", ContentHasher.hash("edited"));
        assertThat(valid("a")).isFalse();
    }

    @Test
    @Tag("unit")
    void entryIsInvalidWhenADependencyChangedOrCannotBeResolved() {
        // Arrange
        cache.setTransformed("b", entry("b", Set.of()));
        cache.setTransformed("a", entry("a", Set.of("b")));

        // Act
        currentHashes.put("b", ContentHasher.hash("b was edited"));

        // Assert
        assertThat(valid("a")).isFalse();
        currentHashes.remove("b");
        assertThat(valid("a")).as("unresolvable dependency fails closed").isFalse();
    }

    @Test
    @Tag("unit")
    void invalidatingADependencyCascadesToItsDependents() {
        // Arrange: a -> b, c unrelated
        cache.setTransformed("b", entry("b", Set.of()));
        cache.setTransformed("a", entry("a", Set.of("b")));
        cache.setTransformed("c", entry("c", Set.of()));

        // Act
        Set<String> dependents = cache.invalidate("b");

        // Assert
        assertThat(dependents).containsExactly("a");
        assertThat(cache.getTransformed("a")).isNull();
        assertThat(cache.getTransformed("b")).isNull();
        assertThat(cache.getTransformed("c")).isNotNull();
    }

    @Test
    @Tag("unit")
    void staleDependencyHashAndInvalidationLeaveUnrelatedFilesAlone() {
        // Arrange
        cache.setTransformed("b", entry("b", Set.of()));
        cache.setTransformed("a", entry("a", Set.of("b")));
        cache.setTransformed("c", entry("c", Set.of()));
        currentHashes.put("b", ContentHasher.hash("new b"));

        // Act
        boolean aValid = valid("a");
        cache.invalidate("b");

        // Assert
        assertThat(aValid).isFalse();
        assertThat(cache.getTransformed("a")).isNull();
        assertThat(valid("c")).isTrue();
    }

    @Test
    @Tag("unit")
    void cyclicDependenciesTerminateAndReportEachOther() {
        // Arrange: a -> b -> a
        cache.setTransformed("a", entry("a", Set.of("b")));
        cache.setTransformed("b", entry("b", Set.of("a")));

        // Act
        Set<String> ofA = cache.getTransitiveDependents("a");
        Set<String> ofB = cache.getTransitiveDependents("b");
        Set<String> invalidated = cache.invalidate("a");

        // Assert
        assertThat(ofA).contains("b");
        assertThat(ofB).contains("a");
        assertThat(invalidated).contains("b");
        assertThat(cache.getTransformedFileNames()).isEmpty();
    }

    @Test
    @Tag("unit")
    void exceedingTheBoundEvictsTheLeastRecentlyUsedEntry() {
        // Arrange
        TransformCache bounded = new TransformCache(3);
        bounded.setTransformed("a", entry("a", Set.of()));
        bounded.setTransformed("b", entry("b", Set.of()));
        bounded.setTransformed("c", entry("c", Set.of()));

        // Act
        bounded.setTransformed("d", entry("d", Set.of()));

        // Assert
        assertThat(bounded.getTransformedFileNames()).containsExactly("b", "c", "d");
        assertThat(bounded.getStats().evictions()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void accessProtectsAnEntryFromEviction() {
        // Arrange
        TransformCache bounded = new TransformCache(3);
        bounded.setTransformed("a", entry("a", Set.of()));
        bounded.setTransformed("b", entry("b", Set.of()));
        bounded.setTransformed("c", entry("c", Set.of()));

        // Act
        bounded.getTransformed("a");
        bounded.setTransformed("d", entry("d", Set.of()));

        // Assert
        assertThat(bounded.getTransformed("a")).isNotNull();
        assertThat(bounded.getTransformed("b")).isNull();
    }

    @Test
    @Tag("unit")
    void invalidationReachesDependentsCachedBehindAnEvictedEntry() {
        // Arrange: a -> b -> c, then b is evicted
        TransformCache bounded = new TransformCache(2);
        bounded.setTransformed("b", entry("b", Set.of("c")));
        bounded.setTransformed("a", entry("a", Set.of("b")));
        bounded.getTransformed("a");
        bounded.setTransformed("x", entry("x", Set.of()));

        // Act
        Set<String> dependents = bounded.invalidate("c");

        // Assert
        assertThat(bounded.getTransformedFileNames()).containsExactly("x");
        assertThat(dependents).containsExactlyInAnyOrder("a", "b");
        assertThat(bounded.getTransformed("a")).isNull();
        assertThat(bounded.getStats().evictions()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void preprocessedTierIsValidatedByContentHash() {
        cache.setPreprocessed("f.ts", new PreprocessedCacheEntry("x |> f", "f(x)", null, ContentHasher.hash("x |> f")));

        assertThat(cache.isPreprocessedValid("f.ts", ContentHasher.hash("x |> f"))).isTrue();
        assertThat(cache.isPreprocessedValid("f.ts", ContentHasher.hash("x |> g"))).isFalse();
        assertThat(cache.getPreprocessed("f.ts").changed()).isTrue();
    }

    @Test
    @Tag("unit")
    void clearResetsBothTiersTheGraphAndTheCounters() {
        cache.setPreprocessed("a", new PreprocessedCacheEntry("x", "x", null, ContentHasher.hash("x")));
        cache.setTransformed("a", entry("a", Set.of("b")));
        valid("a");

        cache.clear();

        CacheStats stats = cache.getStats();
        assertThat(stats.preprocessedCount()).isZero();
        assertThat(stats.transformedCount()).isZero();
        assertThat(stats.hits()).isZero();
        assertThat(cache.getDependencyGraph().size()).isZero();
    }

    @Test
    @Tag("unit")
    void rejectsNonPositiveBound() {
        assertThatThrownBy(() -> new TransformCache(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
