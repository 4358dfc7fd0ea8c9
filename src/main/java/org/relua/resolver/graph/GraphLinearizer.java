package org.relua.resolver.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;

/**
 * Cycle-tolerant topological ordering of a {@link GraphSnapshot}.
 *
 * <p>Strongly connected components are computed with Tarjan's algorithm, run iteratively
 * so that long require chains cannot exhaust the call stack. Each component becomes one
 * node of the condensation graph, which is then sorted with Kahn's algorithm.</p>
 *
 * <p>Ties are broken lexicographically: among eligible components, the one with the
 * smallest key (for a cycle group, its smallest member key) goes first, and the members
 * of a cycle group are emitted in key order. The order inside a cycle group is an
 * approximation, since no true dependency order exists there.</p>
 */
public final class GraphLinearizer {

    private static final Logger log = LoggerFactory.getLogger(GraphLinearizer.class);

    /**
     * Orders every node of the snapshot.
     *
     * @param snapshot The quiesced graph.
     * @return The processing order and the detected cycle groups.
     */
    public Linearization linearize(GraphSnapshot snapshot) {
        List<List<String>> components = stronglyConnected(snapshot);

        Map<String, Integer> componentOf = new HashMap<>();
        for (int i = 0; i < components.size(); i++) {
            for (String key : components.get(i)) {
                componentOf.put(key, i);
            }
        }

        // remaining[c]: distinct dependency components not yet emitted
        int[] remaining = new int[components.size()];
        List<Set<Integer>> dependentsOf = new ArrayList<>(components.size());
        for (int i = 0; i < components.size(); i++) {
            dependentsOf.add(new HashSet<>());
        }
        for (int c = 0; c < components.size(); c++) {
            Set<Integer> required = new HashSet<>();
            for (String key : components.get(c)) {
                for (String dependency : snapshot.dependencies(key)) {
                    int target = componentOf.get(dependency);
                    if (target != c) {
                        required.add(target);
                    }
                }
            }
            remaining[c] = required.size();
            for (int target : required) {
                dependentsOf.get(target).add(c);
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>(
                Comparator.comparing((Integer c) -> components.get(c).get(0)));
        for (int c = 0; c < components.size(); c++) {
            if (remaining[c] == 0) {
                ready.add(c);
            }
        }

        List<String> order = new ArrayList<>(snapshot.size());
        List<CycleGroup> cycles = new ArrayList<>();
        while (!ready.isEmpty()) {
            int current = ready.poll();
            List<String> members = components.get(current);
            order.addAll(members);
            if (isCycle(snapshot, members)) {
                cycles.add(new CycleGroup(members, examplePath(snapshot, members)));
            }
            for (int dependent : dependentsOf.get(current)) {
                if (--remaining[dependent] == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() != snapshot.size()) {
            // the condensation is acyclic by construction
            throw new IllegalStateException("Condensation ordering lost "
                    + (snapshot.size() - order.size()) + " modules");
        }
        if (!cycles.isEmpty()) {
            log.warn("Detected {} circular dependency group(s); members are ordered by key", cycles.size());
            for (CycleGroup group : cycles) {
                log.debug("Cycle: {}", String.join(" -> ", group.examplePath()));
            }
        }
        return new Linearization(order, cycles);
    }

    /**
     * Orders {@code startKey} and its transitive dependencies only.
     *
     * @throws IllegalArgumentException if {@code startKey} is not part of the snapshot.
     */
    public Linearization linearize(GraphSnapshot snapshot, String startKey) {
        return linearize(snapshot.closureOf(startKey));
    }

    /**
     * Tarjan's algorithm with an explicit frame stack. Components are returned with
     * their members sorted.
     */
    private List<List<String>> stronglyConnected(GraphSnapshot snapshot) {
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowlink = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();
        List<List<String>> components = new ArrayList<>();
        int counter = 0;

        for (String root : snapshot.keys()) {
            if (index.containsKey(root)) {
                continue;
            }
            Deque<Frame> frames = new ArrayDeque<>();
            index.put(root, counter);
            lowlink.put(root, counter);
            counter++;
            stack.push(root);
            onStack.add(root);
            frames.push(new Frame(root, snapshot.dependencies(root).iterator()));

            while (!frames.isEmpty()) {
                Frame frame = frames.peek();
                if (frame.successors.hasNext()) {
                    String next = frame.successors.next();
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        lowlink.put(next, counter);
                        counter++;
                        stack.push(next);
                        onStack.add(next);
                        frames.push(new Frame(next, snapshot.dependencies(next).iterator()));
                    } else if (onStack.contains(next)) {
                        lowlink.put(frame.key, Math.min(lowlink.get(frame.key), index.get(next)));
                    }
                    continue;
                }

                frames.pop();
                if (lowlink.get(frame.key).equals(index.get(frame.key))) {
                    List<String> component = new ArrayList<>();
                    String member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(frame.key));
                    Collections.sort(component);
                    components.add(component);
                }
                if (!frames.isEmpty()) {
                    Frame parent = frames.peek();
                    lowlink.put(parent.key, Math.min(lowlink.get(parent.key), lowlink.get(frame.key)));
                }
            }
        }
        return components;
    }

    private static boolean isCycle(GraphSnapshot snapshot, List<String> members) {
        return members.size() > 1 || snapshot.node(members.get(0)).hasSelfLoop();
    }

    /**
     * Shortest path from the smallest member back to itself, staying inside the group.
     */
    private static List<String> examplePath(GraphSnapshot snapshot, List<String> members) {
        String start = members.get(0);
        Set<String> group = new TreeSet<>(members);
        Map<String, String> parent = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        Set<String> seen = new HashSet<>();
        seen.add(start);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : snapshot.dependencies(current)) {
                if (!group.contains(next)) {
                    continue;
                }
                if (next.equals(start)) {
                    List<String> steps = new ArrayList<>();
                    for (String step = current; !step.equals(start); step = parent.get(step)) {
                        steps.add(step);
                    }
                    Collections.reverse(steps);
                    List<String> cycle = new ArrayList<>(steps.size() + 2);
                    cycle.add(start);
                    cycle.addAll(steps);
                    cycle.add(start);
                    return cycle;
                }
                if (seen.add(next)) {
                    parent.put(next, current);
                    queue.add(next);
                }
            }
        }
        throw new IllegalStateException("No cycle through " + start + " inside its component");
    }

    private static final class Frame {
        final String key;
        final Iterator<String> successors;

        Frame(String key, Iterator<String> successors) {
            this.key = key;
            this.successors = successors;
        }
    }
}
