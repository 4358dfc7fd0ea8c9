package org.relua.resolver.graph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The mutable module graph of one discovery run.
 *
 * <p>Nodes are indexed by their canonical key and edges are stored as keys
 * (dependent to dependency), so cycles never turn into object reference cycles.
 * Nodes are created exactly once and are never removed; the graph is append-only until
 * {@link #snapshot()} is taken for linearization.</p>
 *
 * <p>Every mutation passes through one write lock, so two workers that discover the same
 * key concurrently still produce a single node. Snapshots take the read lock.</p>
 */
public final class DependencyGraph {

    private final Map<String, ModuleNode> nodes = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private int edgeCount;

    /**
     * Inserts the root node at depth 0. Idempotent.
     *
     * @param key        Canonical path of the root file.
     * @param moduleName Logical name of the root.
     * @return {@code true} if the node was created by this call.
     */
    public boolean addRoot(String key, String moduleName) {
        lock.writeLock().lock();
        try {
            if (nodes.containsKey(key)) {
                return false;
            }
            nodes.put(key, new ModuleNode(key, moduleName, 0));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Adds the edge {@code fromKey -> toKey}. Idempotent.
     * If {@code toKey} is not yet a node it is created in state {@link NodeState#DISCOVERED}
     * one level deeper than {@code fromKey}, named after its key.
     *
     * @return {@code true} if the target node was created by this call.
     * @throws IllegalArgumentException if {@code fromKey} is not a node.
     */
    public boolean addEdge(String fromKey, String toKey) {
        return addEdge(fromKey, toKey, toKey);
    }

    /**
     * Adds the edge {@code fromKey -> toKey}, naming the target {@code moduleName} if it
     * has to be created.
     *
     * @return {@code true} if the target node was created by this call.
     * @throws IllegalArgumentException if {@code fromKey} is not a node.
     */
    public boolean addEdge(String fromKey, String toKey, String moduleName) {
        lock.writeLock().lock();
        try {
            ModuleNode from = require(fromKey);
            boolean created = false;
            if (!nodes.containsKey(toKey)) {
                nodes.put(toKey, new ModuleNode(toKey, moduleName, from.depth + 1));
                created = true;
            }
            if (from.dependencies.add(toKey)) {
                edgeCount++;
            }
            return created;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Moves a node from {@code DISCOVERED} to {@code READING}.
     *
     * @throws IllegalStateException if the node is not in state {@code DISCOVERED}.
     */
    public void beginReading(String key) {
        transition(key, NodeState.DISCOVERED, NodeState.READING);
    }

    /**
     * Caches the file text of a node. The content is immutable after the first read.
     *
     * @throws IllegalStateException if content was already recorded.
     */
    public void recordContent(String key, String content) {
        lock.writeLock().lock();
        try {
            ModuleNode node = require(key);
            if (node.content != null) {
                throw new IllegalStateException("Content of " + key + " was already read");
            }
            node.content = content;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Appends the raw identifiers found in the node's text, in source order.
     */
    public void recordReferences(String key, List<String> identifiers) {
        lock.writeLock().lock();
        try {
            require(key).rawReferences.addAll(identifiers);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void recordUnresolved(String key, UnresolvedReference reference) {
        lock.writeLock().lock();
        try {
            require(key).unresolved.add(reference);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void recordDynamic(String key, int count) {
        lock.writeLock().lock();
        try {
            require(key).dynamicReferences += count;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void recordMalformed(String key, int count) {
        lock.writeLock().lock();
        try {
            require(key).malformedReferences += count;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void markResolved(String key) {
        transition(key, NodeState.READING, NodeState.RESOLVED);
    }

    /**
     * Marks a node whose content was read but whose references were not followed.
     */
    public void markUnresolved(String key) {
        transition(key, NodeState.READING, NodeState.UNRESOLVED);
    }

    /**
     * Marks a node as failed. The node and any edges it already has are kept; consumers
     * must treat its outgoing edge set as incomplete.
     *
     * @param key   The failed node.
     * @param cause The read failure.
     */
    public void markError(String key, Throwable cause) {
        lock.writeLock().lock();
        try {
            ModuleNode node = require(key);
            node.state = NodeState.ERROR;
            node.error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean contains(String key) {
        lock.readLock().lock();
        try {
            return nodes.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public NodeState state(String key) {
        lock.readLock().lock();
        try {
            return require(key).state;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int depth(String key) {
        lock.readLock().lock();
        try {
            return require(key).depth;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return nodes.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int edgeCount() {
        lock.readLock().lock();
        try {
            return edgeCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Captures an immutable, key-sorted view of the whole graph.
     */
    public GraphSnapshot snapshot() {
        lock.readLock().lock();
        try {
            Map<String, ModuleRecord> records = new TreeMap<>();
            for (ModuleNode node : nodes.values()) {
                records.put(node.key, node.toRecord());
            }
            return new GraphSnapshot(records);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void transition(String key, NodeState expected, NodeState next) {
        lock.writeLock().lock();
        try {
            ModuleNode node = require(key);
            if (node.state != expected) {
                throw new IllegalStateException(
                        "Cannot move " + key + " to " + next + " from " + node.state + " (expected " + expected + ")");
            }
            node.state = next;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private ModuleNode require(String key) {
        ModuleNode node = nodes.get(key);
        if (node == null) {
            throw new IllegalArgumentException("Unknown module: " + key);
        }
        return node;
    }
}
