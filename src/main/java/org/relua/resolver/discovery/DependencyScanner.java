package org.relua.resolver.discovery;

import org.relua.resolver.graph.DependencyGraph;
import org.relua.resolver.graph.GraphLinearizer;
import org.relua.resolver.graph.GraphSnapshot;
import org.relua.resolver.graph.Linearization;
import org.relua.resolver.graph.UnresolvedReference;
import org.relua.resolver.io.SourceLoader;
import org.relua.resolver.io.SourceReader;
import org.relua.resolver.module.ExtractionResult;
import org.relua.resolver.module.ModulePathResolver;
import org.relua.resolver.module.PathResolution;
import org.relua.resolver.module.ReferenceExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

/**
 * Discovers every module reachable from a root file and produces its restoration plan.
 *
 * <p>Nodes are processed from a FIFO worklist seeded with the root. Reading a file,
 * extracting its {@code require} references and resolving them to paths runs on a bounded
 * worker pool; applying the results to the {@link DependencyGraph} is done by the calling
 * thread alone, strictly in worklist order. The sequence of graph mutations is therefore
 * the same for every pool size and the plan is reproducible.</p>
 *
 * <p>At most {@code workers} reads are in flight. The read timeout is measured from the
 * moment a worker starts the read. A timed-out read is abandoned: its slot is freed at
 * once and the next read runs on a fresh thread, so a read that ignores interruption
 * cannot stall the files queued behind it.</p>
 *
 * <p>Failures are node-local: an unreadable file becomes an {@code ERROR} node and a
 * reference that matches no file is recorded on its referencing node. Only an unreadable
 * root aborts the run with a {@link RootModuleException}.</p>
 */
public final class DependencyScanner {

    private static final Logger log = LoggerFactory.getLogger(DependencyScanner.class);

    private final DiscoveryOptions options;
    private final SourceReader reader;
    private final ReferenceExtractor extractor = new ReferenceExtractor();
    private final GraphLinearizer linearizer = new GraphLinearizer();

    public DependencyScanner(DiscoveryOptions options) {
        this(options, new SourceLoader());
    }

    public DependencyScanner(DiscoveryOptions options, SourceReader reader) {
        this.options = options;
        this.reader = reader;
    }

    /**
     * Runs discovery from the given root file and linearizes the result.
     *
     * @param rootFile The file restoration starts from.
     * @return The processing order, cycle report and statistics.
     * @throws RootModuleException If the root file cannot be read.
     */
    public RestorationPlan scan(Path rootFile) throws IOException {
        return scan(rootFile, () -> false);
    }

    /**
     * Runs a cancellable discovery from the given root file and linearizes the result.
     *
     * @param rootFile        The file restoration starts from.
     * @param cancelRequested Polled between worklist items.
     * @return The processing order, cycle report and statistics.
     * @throws RootModuleException   If the root file cannot be read.
     * @throws CancellationException If cancellation was requested or the thread interrupted;
     *                               the partial graph is discarded.
     */
    public RestorationPlan scan(Path rootFile, BooleanSupplier cancelRequested) throws IOException {
        String rootKey = SourceLoader.canonicalize(rootFile).toString();
        DependencyGraph graph = discover(rootFile, cancelRequested);
        GraphSnapshot snapshot = graph.snapshot();
        Linearization linearization = linearizer.linearize(snapshot);
        RestorationPlan plan = RestorationPlan.of(rootKey, snapshot, linearization);
        ScanStatistics stats = plan.statistics();
        log.info("Discovery finished: {} modules, {} edges, {} unresolved references, {} errors, {} cycle groups",
                stats.totalNodes(), stats.totalEdges(), stats.unresolvedReferences(),
                stats.errorNodes(), stats.cycleGroups());
        return plan;
    }

    /**
     * Builds the dependency graph reachable from the root file.
     *
     * @param rootFile        The file discovery starts from.
     * @param cancelRequested Polled between worklist items.
     * @return The quiesced graph.
     * @throws RootModuleException   If the root file cannot be read.
     * @throws CancellationException If cancellation was requested.
     */
    public DependencyGraph discover(Path rootFile, BooleanSupplier cancelRequested) throws IOException {
        ModulePathResolver resolver = new ModulePathResolver(options.searchRoots(), options.extensions());
        DependencyGraph graph = new DependencyGraph();
        String rootKey = SourceLoader.canonicalize(rootFile).toString();
        graph.addRoot(rootKey, resolver.moduleNameOf(rootFile));
        log.info("Starting discovery at {} ({} search roots, {} workers)",
                rootKey, resolver.searchRoots().size(), options.workers());

        // in-flight reads are capped below; the pool only has to replace abandoned threads
        ExecutorService executor = Executors.newCachedThreadPool(new WorkerThreadFactory());
        Deque<String> worklist = new ArrayDeque<>();
        Deque<PendingScan> inFlight = new ArrayDeque<>();
        worklist.add(rootKey);
        try {
            while (!worklist.isEmpty() || !inFlight.isEmpty()) {
                checkCancelled(cancelRequested);
                while (inFlight.size() < options.workers() && !worklist.isEmpty()) {
                    String key = worklist.poll();
                    boolean follow = options.followsReferencesAt(graph.depth(key));
                    graph.beginReading(key);
                    AtomicLong startedAt = new AtomicLong();
                    Future<NodeScan> future = executor.submit(() -> {
                        startedAt.set(System.nanoTime());
                        return scanNode(key, follow, resolver);
                    });
                    inFlight.add(new PendingScan(key, follow, future, startedAt));
                }
                PendingScan pending = inFlight.poll();
                apply(graph, pending, await(pending, rootKey, graph), worklist);
            }
        } finally {
            executor.shutdownNow();
        }
        return graph;
    }

    /**
     * Worker side: reads, extracts and resolves. Touches no shared graph state.
     */
    private NodeScan scanNode(String key, boolean follow, ModulePathResolver resolver) throws IOException {
        String content = reader.read(Path.of(key));
        if (!follow) {
            return new NodeScan(content, null, List.of());
        }
        ExtractionResult extraction = extractor.extract(content);
        List<PathResolution> resolutions = new ArrayList<>();
        for (String identifier : new LinkedHashSet<>(extraction.identifiers())) {
            resolutions.add(resolver.resolve(identifier));
        }
        return new NodeScan(content, extraction, resolutions);
    }

    /**
     * Waits for a worker result. Returns {@code null} after marking the node as failed.
     */
    private NodeScan await(PendingScan pending, String rootKey, DependencyGraph graph) throws RootModuleException {
        Throwable failure;
        try {
            return pending.future.get(remainingNanos(pending), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Discovery interrupted while reading " + pending.key);
        } catch (TimeoutException e) {
            pending.future.cancel(true);
            failure = new IOException("Timed out after " + options.readTimeout().toMillis() + " ms reading " + pending.key, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (!(cause instanceof IOException) && !(cause instanceof UncheckedIOException)) {
                throw new IllegalStateException("Failed to scan " + pending.key, cause);
            }
            failure = cause;
        }

        if (pending.key.equals(rootKey)) {
            throw new RootModuleException(rootKey, failure);
        }
        log.warn("Could not read {}: {}", pending.key, failure.getMessage());
        graph.markError(pending.key, failure);
        return null;
    }

    /**
     * Time left until the read of {@code pending} exceeds its timeout, counted from the
     * start of the read. A read that has not started yet gets the full timeout.
     */
    private long remainingNanos(PendingScan pending) {
        long timeout = options.readTimeout().toNanos();
        long started = pending.startedAt.get();
        if (started == 0) {
            return timeout;
        }
        return Math.max(0, timeout - (System.nanoTime() - started));
    }

    /**
     * Coordinator side: the only place the graph is mutated during discovery.
     */
    private void apply(DependencyGraph graph, PendingScan pending, NodeScan scan, Deque<String> worklist) {
        if (scan == null) {
            return;
        }
        String key = pending.key;
        graph.recordContent(key, scan.content);
        if (!pending.follow) {
            log.debug("Depth limit reached at {}, references not followed", key);
            graph.markUnresolved(key);
            return;
        }

        graph.recordReferences(key, scan.extraction.identifiers());
        graph.recordDynamic(key, (int) scan.extraction.dynamicCount());
        graph.recordMalformed(key, (int) scan.extraction.malformedCount());

        for (PathResolution resolution : scan.resolutions) {
            if (resolution.isResolved()) {
                String dependencyKey = resolution.path().toString();
                if (graph.addEdge(key, dependencyKey, resolution.identifier())) {
                    worklist.add(dependencyKey);
                }
            } else {
                log.warn("Unresolved module '{}' required by {}", resolution.identifier(), key);
                graph.recordUnresolved(key, new UnresolvedReference(resolution.identifier(), resolution.candidates()));
            }
        }
        graph.markResolved(key);
        log.debug("Resolved {} ({} references)", key, scan.resolutions.size());
    }

    private static void checkCancelled(BooleanSupplier cancelRequested) {
        if (cancelRequested.getAsBoolean() || Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Discovery cancelled");
        }
    }

    private record NodeScan(String content, ExtractionResult extraction, List<PathResolution> resolutions) {}

    private record PendingScan(String key, boolean follow, Future<NodeScan> future, AtomicLong startedAt) {}

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "discovery-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
