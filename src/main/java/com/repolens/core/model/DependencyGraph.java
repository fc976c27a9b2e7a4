package com.repolens.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Directed file-to-file graph: an edge {@code a -> b} means "a imports b".
 * <p>
 * Both directions are queryable. Only paths from the scanned file set appear as
 * nodes; unresolved imports never become dangling nodes. The graph may contain
 * cycles, so traversals must track visited nodes.
 */
public final class DependencyGraph {

    public static final DependencyGraph EMPTY = new DependencyGraph(Map.of(), Map.of());

    private final Map<String, SortedSet<String>> forward;
    private final Map<String, SortedSet<String>> reverse;

    private DependencyGraph(Map<String, SortedSet<String>> forward, Map<String, SortedSet<String>> reverse) {
        this.forward = forward;
        this.reverse = reverse;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Paths {@code path} imports. */
    public Set<String> dependenciesOf(String path) {
        return forward.getOrDefault(path, Collections.emptySortedSet());
    }

    /** Paths that import {@code path}. */
    public Set<String> dependentsOf(String path) {
        return reverse.getOrDefault(path, Collections.emptySortedSet());
    }

    /** Union of both directions, in path order. */
    public Set<String> neighborsOf(String path) {
        var neighbors = new TreeSet<String>(dependenciesOf(path));
        neighbors.addAll(dependentsOf(path));
        return Collections.unmodifiableSortedSet(neighbors);
    }

    public boolean hasEdge(String from, String to) {
        return dependenciesOf(from).contains(to);
    }

    public int edgeCount() {
        return forward.values().stream().mapToInt(Set::size).sum();
    }

    /** Forward adjacency as an unmodifiable map. */
    public Map<String, SortedSet<String>> asMap() {
        return forward;
    }

    public static final class Builder {

        private final Map<String, SortedSet<String>> forward = new TreeMap<>();
        private final Map<String, SortedSet<String>> reverse = new TreeMap<>();

        private Builder() {}

        /** Adds {@code from -> to}. Self-references are ignored. */
        public Builder addEdge(String from, String to) {
            if (from.equals(to)) {
                return this;
            }
            forward.computeIfAbsent(from, k -> new TreeSet<>()).add(to);
            reverse.computeIfAbsent(to, k -> new TreeSet<>()).add(from);
            return this;
        }

        public DependencyGraph build() {
            return new DependencyGraph(freeze(forward), freeze(reverse));
        }

        private static Map<String, SortedSet<String>> freeze(Map<String, SortedSet<String>> source) {
            var frozen = new TreeMap<String, SortedSet<String>>();
            source.forEach((k, v) -> frozen.put(k, Collections.unmodifiableSortedSet(new TreeSet<>(v))));
            return Collections.unmodifiableMap(frozen);
        }
    }
}
