package org.relua.resolver.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Mutable per-file record owned by {@link DependencyGraph}. Edges are stored as keys and
 * resolved by lookup in the owning graph.
 */
final class ModuleNode {

    final String key;
    final String moduleName;
    final int depth;
    NodeState state = NodeState.DISCOVERED;
    final List<String> rawReferences = new ArrayList<>();
    String content;
    final SortedSet<String> dependencies = new TreeSet<>();
    final List<UnresolvedReference> unresolved = new ArrayList<>();
    int dynamicReferences;
    int malformedReferences;
    String error;

    ModuleNode(String key, String moduleName, int depth) {
        this.key = key;
        this.moduleName = moduleName;
        this.depth = depth;
    }

    ModuleRecord toRecord() {
        return new ModuleRecord(key, moduleName, depth, state, rawReferences, content,
                new ArrayList<>(dependencies), unresolved, dynamicReferences, malformedReferences, error);
    }
}
