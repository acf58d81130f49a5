package org.typeweave.compiler.cache;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Forward and reverse file dependency edges, kept mutually consistent.
 * <p>
 * An edge {@code a -> b} means that the transformation of {@code a} depended on {@code b}.
 * The graph may contain cycles; every traversal marks visited nodes.
 */
public class DependencyGraph {

    private final Map<String, Set<String>> dependencies = new HashMap<>();
    private final Map<String, Set<String>> dependents = new HashMap<>();

    /**
     * Replaces the outgoing edges of a file. Reverse edges of the old dependencies are removed
     * before the new ones are added.
     * @param fileName The file.
     * @param deps     The files it depends on.
     */
    public void setDependencies(String fileName, Set<String> deps) {
        removeForwardEdges(fileName);
        Set<String> copy = new LinkedHashSet<>(deps);
        dependencies.put(fileName, copy);
        for (String dep : copy) {
            dependents.computeIfAbsent(dep, k -> new LinkedHashSet<>()).add(fileName);
        }
    }

    public Set<String> getDependencies(String fileName) {
        return Collections.unmodifiableSet(dependencies.getOrDefault(fileName, Set.of()));
    }

    public Set<String> getDependents(String fileName) {
        return Collections.unmodifiableSet(dependents.getOrDefault(fileName, Set.of()));
    }

    /**
     * Collects every file that directly or indirectly depends on the given one. A file that is part of
     * a cycle through {@code fileName} is reported too, including {@code fileName} itself.
     * @param fileName The file.
     * @return The transitive dependents.
     */
    public Set<String> getTransitiveDependents(String fileName) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(fileName);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            for (String dependent : dependents.getOrDefault(current, Set.of())) {
                if (visited.add(dependent)) {
                    stack.push(dependent);
                }
            }
        }
        return visited;
    }

    /**
     * Removes only the outgoing edges of a file, keeping the edges of files that depend on it.
     */
    public void removeForwardEdges(String fileName) {
        Set<String> old = dependencies.remove(fileName);
        if (old == null) {
            return;
        }
        for (String dep : old) {
            Set<String> reverse = dependents.get(dep);
            if (reverse != null) {
                reverse.remove(fileName);
                if (reverse.isEmpty()) {
                    dependents.remove(dep);
                }
            }
        }
    }

    /**
     * Removes a file and every edge touching it.
     */
    public void remove(String fileName) {
        removeForwardEdges(fileName);
        Set<String> incoming = dependents.remove(fileName);
        if (incoming != null) {
            for (String dependent : incoming) {
                Set<String> forward = dependencies.get(dependent);
                if (forward != null) {
                    forward.remove(fileName);
                }
            }
        }
    }

    public int size() {
        return dependencies.size();
    }

    public void clear() {
        dependencies.clear();
        dependents.clear();
    }
}
