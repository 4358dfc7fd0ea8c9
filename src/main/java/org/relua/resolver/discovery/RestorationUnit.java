package org.relua.resolver.discovery;

import org.relua.resolver.graph.NodeState;

import java.util.List;

/**
 * One file handed to the restoration collaborator, in processing order.
 *
 * @param nodeKey                Canonical path of the file.
 * @param moduleName             Logical module name.
 * @param state                  Final discovery state; {@code ERROR} units carry no content.
 * @param content                The decompiled text, or {@code null} if it could not be read.
 * @param resolvedDependencyKeys Keys of the files this one requires, sorted.
 */
public record RestorationUnit(
        String nodeKey,
        String moduleName,
        NodeState state,
        String content,
        List<String> resolvedDependencyKeys
) {

    public RestorationUnit {
        resolvedDependencyKeys = List.copyOf(resolvedDependencyKeys);
    }
}
