package org.typeweave.compiler.cache;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests that forward and reverse edges stay consistent and that traversals are cycle-safe.
 */
public class DependencyGraphTest {

    @Test
    @Tag("unit")
    void replacingDependenciesRemovesOldReverseEdges() {
        DependencyGraph graph = new DependencyGraph();
        graph.setDependencies("a", Set.of("b", "c"));

        graph.setDependencies("a", Set.of("c", "d"));

        assertThat(graph.getDependencies("a")).containsExactlyInAnyOrder("c", "d");
        assertThat(graph.getDependents("b")).isEmpty();
        assertThat(graph.getDependents("c")).containsExactly("a");
        assertThat(graph.getDependents("d")).containsExactly("a");
    }

    @Test
    @Tag("unit")
    void transitiveDependentsFollowReverseEdges() {
        // a -> b -> c, d -> c
        DependencyGraph graph = new DependencyGraph();
        graph.setDependencies("a", Set.of("b"));
        graph.setDependencies("b", Set.of("c"));
        graph.setDependencies("d", Set.of("c"));

        assertThat(graph.getTransitiveDependents("c")).containsExactlyInAnyOrder("a", "b", "d");
        assertThat(graph.getTransitiveDependents("a")).isEmpty();
    }

    @Test
    @Tag("unit")
    void cycleIsTraversedOnce() {
        DependencyGraph graph = new DependencyGraph();
        graph.setDependencies("a", Set.of("b"));
        graph.setDependencies("b", Set.of("a"));

        assertThat(graph.getTransitiveDependents("a")).containsExactlyInAnyOrder("a", "b");
        assertThat(graph.getTransitiveDependents("b")).containsExactlyInAnyOrder("a", "b");
    }

    @Test
    @Tag("unit")
    void removeDropsEveryEdgeTouchingTheFile() {
        DependencyGraph graph = new DependencyGraph();
        graph.setDependencies("a", Set.of("b"));
        graph.setDependencies("b", Set.of("c"));

        graph.remove("b");

        assertThat(graph.getDependencies("a")).isEmpty();
        assertThat(graph.getDependents("c")).isEmpty();
        assertThat(graph.getDependents("b")).isEmpty();
    }
}
