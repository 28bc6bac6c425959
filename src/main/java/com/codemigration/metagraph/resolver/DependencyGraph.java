package com.codemigration.metagraph.resolver;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;

/**
 * In-memory file dependency graph. An edge {@code a -> b} means {@code a} depends on {@code b}
 * (imports or references it).
 *
 * <p>Nodes keep the order they were added in; that order is the tie-break for
 * {@link #topologicalOrder()}. Every algorithm here is iterative, so deep import chains do not
 * exhaust the stack.
 */
public class DependencyGraph {

    private final Map<String, Integer> order = new LinkedHashMap<>();
    private final Map<String, Set<String>> outgoing = new HashMap<>();

    /**
     * @param nodes Nodes in tie-break order
     * @param edges Pairs {@code [from, to]}; edges touching unknown nodes and self-loops are ignored
     */
    public DependencyGraph(Collection<String> nodes, Collection<List<String>> edges) {
        for (String node : nodes) {
            order.putIfAbsent(node, order.size());
            outgoing.putIfAbsent(node, new TreeSet<>());
        }
        for (List<String> edge : edges) {
            addEdge(edge.get(0), edge.get(1));
        }
    }

    private DependencyGraph(DependencyGraph source) {
        order.putAll(source.order);
        source.outgoing.forEach((node, targets) -> outgoing.put(node, new TreeSet<>(targets)));
    }

    private void addEdge(String from, String to) {
        if (from.equals(to) || !order.containsKey(from) || !order.containsKey(to)) {
            return;
        }
        outgoing.get(from).add(to);
    }

    public Set<String> nodes() {
        return Collections.unmodifiableSet(order.keySet());
    }

    public Set<String> dependenciesOf(String node) {
        return Collections.unmodifiableSet(outgoing.getOrDefault(node, Set.of()));
    }

    public int edgeCount() {
        return outgoing.values().stream().mapToInt(Set::size).sum();
    }

    /**
     * Nodes reachable from {@code start}, excluding {@code start} itself, in BFS order.
     *
     * @param maxDepth Maximum hops; zero or negative means unbounded
     */
    public List<String> closure(String start, int maxDepth) {
        Set<String> visited = new LinkedHashSet<>();
        visited.add(start);
        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(start);
        int depth = 0;
        while (!frontier.isEmpty() && (maxDepth <= 0 || depth < maxDepth)) {
            Deque<String> next = new ArrayDeque<>();
            for (String node : frontier) {
                for (String target : outgoing.getOrDefault(node, Set.of())) {
                    if (visited.add(target)) {
                        next.add(target);
                    }
                }
            }
            frontier = next;
            depth++;
        }
        visited.remove(start);
        return new ArrayList<>(visited);
    }

    /**
     * Strongly connected components (Tarjan), each sorted by node name, listed in order of their
     * smallest member.
     */
    public List<List<String>> stronglyConnectedComponents() {
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowLink = new HashMap<>();
        Set<String> onStack = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        List<List<String>> components = new ArrayList<>();
        int counter = 0;

        for (String root : order.keySet()) {
            if (index.containsKey(root)) {
                continue;
            }
            // explicit DFS stack of (node, iterator over its targets)
            Deque<Map.Entry<String, Iterator<String>>> work = new ArrayDeque<>();
            index.put(root, counter);
            lowLink.put(root, counter);
            counter++;
            stack.push(root);
            onStack.add(root);
            work.push(Map.entry(root, outgoing.get(root).iterator()));

            while (!work.isEmpty()) {
                Map.Entry<String, Iterator<String>> frame = work.peek();
                String node = frame.getKey();
                Iterator<String> targets = frame.getValue();
                if (targets.hasNext()) {
                    String target = targets.next();
                    if (!index.containsKey(target)) {
                        index.put(target, counter);
                        lowLink.put(target, counter);
                        counter++;
                        stack.push(target);
                        onStack.add(target);
                        work.push(Map.entry(target, outgoing.get(target).iterator()));
                    } else if (onStack.contains(target)) {
                        lowLink.put(node, Math.min(lowLink.get(node), index.get(target)));
                    }
                    continue;
                }
                work.pop();
                if (!work.isEmpty()) {
                    String parent = work.peek().getKey();
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(node)));
                }
                if (lowLink.get(node).equals(index.get(node))) {
                    List<String> component = new ArrayList<>();
                    String member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(node));
                    Collections.sort(component);
                    components.add(component);
                }
            }
        }
        components.sort(Comparator.comparing(c -> c.get(0)));
        return components;
    }

    /**
     * Components with more than one node, i.e. dependency cycles.
     */
    public List<List<String>> cycles() {
        return stronglyConnectedComponents().stream().filter(c -> c.size() > 1).toList();
    }

    /**
     * Acyclic copy of this graph. In every cycle the member with the lowest name drops its edges
     * to the other members; this repeats until no cycle is left. The result is the same for the
     * same input.
     */
    public CycleBreak breakCycles() {
        DependencyGraph acyclic = new DependencyGraph(this);
        List<List<String>> detected = new ArrayList<>();
        List<List<String>> removed = new ArrayList<>();
        List<List<String>> cycles = acyclic.cycles();
        while (!cycles.isEmpty()) {
            for (List<String> cycle : cycles) {
                detected.add(cycle);
                String lowest = cycle.get(0);
                Set<String> members = new TreeSet<>(cycle);
                for (String target : new ArrayList<>(acyclic.outgoing.get(lowest))) {
                    if (members.contains(target)) {
                        acyclic.outgoing.get(lowest).remove(target);
                        removed.add(List.of(lowest, target));
                    }
                }
            }
            cycles = acyclic.cycles();
        }
        return new CycleBreak(acyclic, detected, removed);
    }

    /**
     * Dependencies-first order: a node appears after everything it depends on. Among nodes that
     * are ready at the same time, the one added to the graph first goes first.
     *
     * @throws IllegalStateException when the graph still has a cycle
     */
    public List<String> topologicalOrder() {
        Map<String, Integer> pending = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (String node : order.keySet()) {
            pending.put(node, outgoing.get(node).size());
            for (String target : outgoing.get(node)) {
                dependents.computeIfAbsent(target, k -> new ArrayList<>()).add(node);
            }
        }

        PriorityQueue<String> ready = new PriorityQueue<>(Comparator.comparingInt(order::get));
        pending.forEach((node, count) -> {
            if (count == 0) {
                ready.add(node);
            }
        });

        List<String> sorted = new ArrayList<>(order.size());
        while (!ready.isEmpty()) {
            String node = ready.poll();
            sorted.add(node);
            for (String dependent : dependents.getOrDefault(node, List.of())) {
                if (pending.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (sorted.size() != order.size()) {
            throw new IllegalStateException("Dependency graph still has a cycle");
        }
        return sorted;
    }

    /**
     * @param graph Acyclic graph
     * @param cycles Every cycle found, each sorted by node name
     * @param removedEdges Edges dropped to break them, as {@code [from, to]}
     */
    public record CycleBreak(DependencyGraph graph, List<List<String>> cycles, List<List<String>> removedEdges) {
    }
}
