package org.relua.resolver.module;

import org.relua.resolver.io.SourceLoader;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps logical module identifiers to files under an ordered list of search roots.
 * <p>
 * The identifier {@code a.b.c} becomes the relative path {@code a/b/c} followed by one of
 * the configured extensions. Roots are tried in their configured order and, within a
 * root, extensions are tried in their configured order; the first regular file wins.
 * <p>
 * Only when no root holds the standard layout are two decompiler layouts probed, again
 * root by root: the package directory {@code a/b/c/c<ext>} and then the bare last
 * segment {@code c<ext>} directly under the root.
 * <p>
 * One instance belongs to one discovery run. Results are memoized in an instance cache,
 * which assumes the filesystem does not change while the run is active. The cache is
 * safe for concurrent use.
 */
public final class ModulePathResolver {

    private final List<Path> searchRoots;
    private final List<String> extensions;
    private final Map<String, PathResolution> cache = new ConcurrentHashMap<>();

    /**
     * @param searchRoots Search roots in priority order.
     * @param extensions  File extensions including the leading dot, in priority order.
     */
    public ModulePathResolver(List<Path> searchRoots, List<String> extensions) {
        if (extensions.isEmpty()) {
            throw new IllegalArgumentException("At least one source-file extension is required");
        }
        List<Path> roots = new ArrayList<>(searchRoots.size());
        for (Path root : searchRoots) {
            roots.add(SourceLoader.canonicalize(root));
        }
        this.searchRoots = List.copyOf(roots);
        this.extensions = List.copyOf(extensions);
    }

    public List<Path> searchRoots() {
        return searchRoots;
    }

    public List<String> extensions() {
        return extensions;
    }

    /**
     * Resolves a logical identifier to the first existing file.
     *
     * @param identifier The dotted module name.
     * @return A resolved result, or an unresolved result listing the probed candidates.
     */
    public PathResolution resolve(String identifier) {
        PathResolution cached = cache.get(identifier);
        if (cached != null) {
            return cached;
        }
        // probe outside the map so disk access never holds a map bin
        PathResolution probed = probe(identifier);
        PathResolution raced = cache.putIfAbsent(identifier, probed);
        return raced != null ? raced : probed;
    }

    private PathResolution probe(String identifier) {
        if (!ModuleNames.isValid(identifier)) {
            return PathResolution.unresolved(identifier, List.of());
        }
        String[] segments = ModuleNames.segments(identifier);
        String relative = String.join("/", segments);
        String last = segments[segments.length - 1];

        Set<Path> candidates = new LinkedHashSet<>();
        for (Path root : searchRoots) {
            for (String extension : extensions) {
                Path found = tryCandidate(root.resolve(relative + extension), candidates);
                if (found != null) {
                    return PathResolution.resolved(identifier, found, new ArrayList<>(candidates));
                }
            }
        }
        for (Path root : searchRoots) {
            for (String extension : extensions) {
                Path found = tryCandidate(root.resolve(relative).resolve(last + extension), candidates);
                if (found != null) {
                    return PathResolution.resolved(identifier, found, new ArrayList<>(candidates));
                }
            }
            for (String extension : extensions) {
                Path found = tryCandidate(root.resolve(last + extension), candidates);
                if (found != null) {
                    return PathResolution.resolved(identifier, found, new ArrayList<>(candidates));
                }
            }
        }
        return PathResolution.unresolved(identifier, new ArrayList<>(candidates));
    }

    /**
     * Records the candidate and returns its canonical path if it is a regular file.
     * A path probed before is skipped.
     */
    private static Path tryCandidate(Path candidate, Set<Path> candidates) {
        Path normalized = candidate.normalize();
        if (!candidates.add(normalized)) {
            return null;
        }
        return Files.isRegularFile(normalized) ? SourceLoader.canonicalize(normalized) : null;
    }

    /**
     * Derives the logical identifier of a file, the inverse of {@link #resolve(String)}.
     * <p>
     * Uses the first search root that contains the file. Files outside every root are
     * named after their file name.
     *
     * @param file Any path to a module file.
     * @return The dotted module name.
     */
    public String moduleNameOf(Path file) {
        Path canonical = SourceLoader.canonicalize(file);
        for (Path root : searchRoots) {
            if (canonical.startsWith(root) && !canonical.equals(root)) {
                Path relative = root.relativize(canonical);
                List<String> parts = new ArrayList<>(relative.getNameCount());
                for (Path part : relative) {
                    parts.add(part.toString());
                }
                int last = parts.size() - 1;
                parts.set(last, stripExtension(parts.get(last)));
                return String.join(String.valueOf(ModuleNames.SEPARATOR), parts);
            }
        }
        Path fileName = canonical.getFileName();
        return fileName == null ? canonical.toString() : stripExtension(fileName.toString());
    }

    private String stripExtension(String fileName) {
        for (String extension : extensions) {
            if (fileName.endsWith(extension) && fileName.length() > extension.length()) {
                return fileName.substring(0, fileName.length() - extension.length());
            }
        }
        int dot = fileName.indexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
