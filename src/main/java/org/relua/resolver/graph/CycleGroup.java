package org.relua.resolver.graph;

import java.util.List;

/**
 * A strongly connected component that forms a cycle: more than one member, or a single
 * member that requires itself.
 *
 * @param members     Member keys in lexicographic order.
 * @param examplePath A concrete cycle starting and ending at the smallest member,
 *                    e.g. {@code [A, B, A]}.
 */
public record CycleGroup(List<String> members, List<String> examplePath) {

    public CycleGroup {
        members = List.copyOf(members);
        examplePath = List.copyOf(examplePath);
    }

    /** The smallest member key, which also represents the group during ordering. */
    public String representative() {
        return members.get(0);
    }
}
