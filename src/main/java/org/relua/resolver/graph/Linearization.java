package org.relua.resolver.graph;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Deterministic processing order of a graph plus the cycles found in it.
 *
 * @param order  Node keys, dependencies before dependents wherever no cycle intervenes.
 * @param cycles Detected cycle groups, ordered by their position in {@code order}.
 */
public record Linearization(List<String> order, List<CycleGroup> cycles) {

    public Linearization {
        order = List.copyOf(order);
        cycles = List.copyOf(cycles);
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }

    /** Keys that belong to any cycle group. */
    public Set<String> cyclicKeys() {
        Set<String> keys = new HashSet<>();
        for (CycleGroup group : cycles) {
            keys.addAll(group.members());
        }
        return keys;
    }
}
