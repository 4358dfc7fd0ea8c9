package org.relua.resolver.module;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of resolving one logical identifier against the search roots.
 *
 * @param identifier The logical identifier as written in the referencing file.
 * @param path       The canonical path of the first matching file, or {@code null} if unresolved.
 * @param candidates Every path that was probed, in probe order.
 */
public record PathResolution(String identifier, Path path, List<Path> candidates) {

    public PathResolution {
        candidates = List.copyOf(candidates);
    }

    static PathResolution resolved(String identifier, Path path, List<Path> candidates) {
        return new PathResolution(identifier, path, candidates);
    }

    static PathResolution unresolved(String identifier, List<Path> candidates) {
        return new PathResolution(identifier, null, candidates);
    }

    public boolean isResolved() {
        return path != null;
    }
}
