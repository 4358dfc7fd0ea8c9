package org.relua.resolver.graph;

import java.nio.file.Path;
import java.util.List;

/**
 * A logical identifier that matched no file under any search root.
 *
 * @param identifier The dotted module name as written.
 * @param candidates The paths that were probed, in probe order.
 */
public record UnresolvedReference(String identifier, List<Path> candidates) {

    public UnresolvedReference {
        candidates = List.copyOf(candidates);
    }
}
