package org.relua.resolver.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable, key-sorted view of a {@link DependencyGraph}.
 * <p>
 * Offers the read-only queries of the graph: direct and transitive dependencies, the
 * reverse (dependent) index, and edge counts.
 */
public final class GraphSnapshot {

    private final SortedMap<String, ModuleRecord> nodes;
    private final Map<String, Set<String>> dependents;
    private final int edgeCount;

    GraphSnapshot(Map<String, ModuleRecord> records) {
        this.nodes = Collections.unmodifiableSortedMap(new TreeMap<>(records));
        Map<String, Set<String>> reverse = new TreeMap<>();
        int edges = 0;
        for (ModuleRecord node : nodes.values()) {
            reverse.computeIfAbsent(node.key(), k -> new TreeSet<>());
            for (String dependency : node.dependencies()) {
                reverse.computeIfAbsent(dependency, k -> new TreeSet<>()).add(node.key());
                edges++;
            }
        }
        reverse.replaceAll((key, set) -> Collections.unmodifiableSet(set));
        this.dependents = Collections.unmodifiableMap(reverse);
        this.edgeCount = edges;
    }

    /** All nodes in lexicographic key order. */
    public Collection<ModuleRecord> nodes() {
        return nodes.values();
    }

    public Set<String> keys() {
        return nodes.keySet();
    }

    public int size() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public boolean contains(String key) {
        return nodes.containsKey(key);
    }

    /**
     * @throws IllegalArgumentException if the key is not part of the snapshot.
     */
    public ModuleRecord node(String key) {
        ModuleRecord node = nodes.get(key);
        if (node == null) {
            throw new IllegalArgumentException("Unknown module: " + key);
        }
        return node;
    }

    /** Keys the given node requires directly, sorted. */
    public List<String> dependencies(String key) {
        return node(key).dependencies();
    }

    /** Keys of nodes that require the given node directly, sorted. */
    public Set<String> dependents(String key) {
        node(key);
        return dependents.get(key);
    }

    /**
     * All nodes reachable from {@code key} by following dependency edges, excluding
     * {@code key} itself unless it lies on a cycle.
     */
    public Set<String> transitiveDependencies(String key) {
        Set<String> reached = new TreeSet<>();
        Deque<String> pending = new ArrayDeque<>(dependencies(key));
        while (!pending.isEmpty()) {
            String current = pending.pop();
            if (reached.add(current)) {
                pending.addAll(node(current).dependencies());
            }
        }
        return reached;
    }

    /**
     * Restricts the snapshot to {@code key} and its transitive dependencies.
     */
    public GraphSnapshot closureOf(String key) {
        Set<String> keep = new TreeSet<>(transitiveDependencies(key));
        keep.add(key);
        Map<String, ModuleRecord> records = new TreeMap<>();
        for (String member : keep) {
            records.put(member, nodes.get(member));
        }
        return new GraphSnapshot(records);
    }

    /**
     * Counts references that matched no file, across all nodes.
     */
    public int unresolvedReferenceCount() {
        int count = 0;
        for (ModuleRecord node : nodes.values()) {
            count += node.unresolvedReferences().size();
        }
        return count;
    }

    /**
     * Lists the nodes in the given state, in key order.
     */
    public List<ModuleRecord> nodesIn(NodeState state) {
        List<ModuleRecord> matching = new ArrayList<>();
        for (ModuleRecord node : nodes.values()) {
            if (node.state() == state) {
                matching.add(node);
            }
        }
        return matching;
    }
}
