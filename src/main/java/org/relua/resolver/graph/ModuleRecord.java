package org.relua.resolver.graph;

import java.util.List;

/**
 * Immutable view of one node, as captured by {@link DependencyGraph#snapshot()}.
 *
 * @param key                  Canonical absolute path of the file.
 * @param moduleName           Logical identifier the node was first discovered under.
 * @param depth                Breadth-first distance from the root.
 * @param state                Lifecycle state at snapshot time.
 * @param rawReferences        Identifiers found in the text, in source order with duplicates.
 * @param content              Cached file text, or {@code null} if never read.
 * @param dependencies         Keys of required nodes, sorted.
 * @param unresolvedReferences Identifiers that matched no file.
 * @param dynamicReferences    Number of references with a runtime-computed argument.
 * @param malformedReferences  Number of syntactically broken references.
 * @param error                Read failure message, or {@code null}.
 */
public record ModuleRecord(
        String key,
        String moduleName,
        int depth,
        NodeState state,
        List<String> rawReferences,
        String content,
        List<String> dependencies,
        List<UnresolvedReference> unresolvedReferences,
        int dynamicReferences,
        int malformedReferences,
        String error
) {

    public ModuleRecord {
        rawReferences = List.copyOf(rawReferences);
        dependencies = List.copyOf(dependencies);
        unresolvedReferences = List.copyOf(unresolvedReferences);
    }

    public boolean hasSelfLoop() {
        return dependencies.contains(key);
    }
}
