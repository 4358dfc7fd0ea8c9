package org.relua.resolver.discovery;

import com.typesafe.config.Config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of one discovery run, read from the {@code relua.discovery} block.
 *
 * @param searchRoots Directories searched for modules, in priority order.
 * @param extensions  Source-file extensions with leading dot, in priority order.
 * @param readTimeout Upper bound for reading a single file.
 * @param workers     Size of the read/extract worker pool; 1 reads sequentially.
 * @param maxDepth    Depth at which references stop being followed; 0 means unlimited.
 */
public record DiscoveryOptions(
        List<Path> searchRoots,
        List<String> extensions,
        Duration readTimeout,
        int workers,
        int maxDepth
) {

    public static final String CONFIG_PATH = "relua.discovery";

    public DiscoveryOptions {
        searchRoots = List.copyOf(searchRoots);
        extensions = List.copyOf(extensions);
        if (extensions.isEmpty()) {
            throw new IllegalArgumentException("At least one extension is required");
        }
        for (String extension : extensions) {
            if (!extension.startsWith(".") || extension.length() < 2) {
                throw new IllegalArgumentException("Extension must start with '.': " + extension);
            }
        }
        if (readTimeout.isNegative() || readTimeout.isZero()) {
            throw new IllegalArgumentException("Read timeout must be positive, got " + readTimeout);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("Workers must be >= 1, got " + workers);
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("Max depth must be >= 0, got " + maxDepth);
        }
    }

    /**
     * Reads the options from the given application configuration.
     *
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static DiscoveryOptions fromConfig(Config config) {
        Config discovery = config.getConfig(CONFIG_PATH);
        List<Path> roots = new ArrayList<>();
        for (String root : discovery.getStringList("search-roots")) {
            roots.add(Path.of(root));
        }
        return new DiscoveryOptions(
                roots,
                discovery.getStringList("extensions"),
                discovery.getDuration("read-timeout"),
                discovery.getInt("workers"),
                discovery.getInt("max-depth"));
    }

    public DiscoveryOptions withSearchRoots(List<Path> roots) {
        return new DiscoveryOptions(roots, extensions, readTimeout, workers, maxDepth);
    }

    public DiscoveryOptions withWorkers(int count) {
        return new DiscoveryOptions(searchRoots, extensions, readTimeout, count, maxDepth);
    }

    public DiscoveryOptions withMaxDepth(int depth) {
        return new DiscoveryOptions(searchRoots, extensions, readTimeout, workers, depth);
    }

    /**
     * Whether references of a node at the given depth are followed.
     */
    public boolean followsReferencesAt(int depth) {
        return maxDepth == 0 || depth < maxDepth;
    }
}
