package com.vidnyan.ecv.domain.graph;

import com.vidnyan.ecv.domain.condition.FieldRef;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;

/**
 * Directed graph over the fields of one rule.
 * Adjacency index in both directions, at most one edge per ordered pair.
 * Immutable and thread-safe.
 */
public final class CausalGraph {

    private final Set<FieldRef> nodes;
    private final Map<FieldRef, List<CausalEdge>> outgoing;
    private final Map<FieldRef, List<CausalEdge>> incoming;

    private CausalGraph(Set<FieldRef> nodes,
                        Map<FieldRef, List<CausalEdge>> outgoing,
                        Map<FieldRef, List<CausalEdge>> incoming) {
        this.nodes = Collections.unmodifiableSet(nodes);
        this.outgoing = Collections.unmodifiableMap(outgoing);
        this.incoming = Collections.unmodifiableMap(incoming);
    }

    /**
     * Build a graph. An edge for an ordered pair replaces any earlier edge for the same pair.
     */
    public static CausalGraph build(List<FieldRef> nodes, List<CausalEdge> edges) {
        Map<List<FieldRef>, CausalEdge> byPair = new LinkedHashMap<>();
        for (CausalEdge edge : edges) {
            if (!edge.source().equals(edge.target())) {
                byPair.put(List.of(edge.source(), edge.target()), edge);
            }
        }

        Set<FieldRef> allNodes = new LinkedHashSet<>(nodes);
        Map<FieldRef, List<CausalEdge>> outgoing = new LinkedHashMap<>();
        Map<FieldRef, List<CausalEdge>> incoming = new LinkedHashMap<>();
        for (CausalEdge edge : byPair.values()) {
            allNodes.add(edge.source());
            allNodes.add(edge.target());
            outgoing.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge);
            incoming.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge);
        }
        outgoing.replaceAll((k, v) -> List.copyOf(v));
        incoming.replaceAll((k, v) -> List.copyOf(v));
        return new CausalGraph(allNodes, outgoing, incoming);
    }

    public Set<FieldRef> nodes() {
        return nodes;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public List<CausalEdge> outgoing(FieldRef node) {
        return outgoing.getOrDefault(node, List.of());
    }

    public List<CausalEdge> incoming(FieldRef node) {
        return incoming.getOrDefault(node, List.of());
    }

    public Optional<CausalEdge> edge(FieldRef source, FieldRef target) {
        return outgoing(source).stream()
                .filter(e -> e.target().equals(target))
                .findFirst();
    }

    public int outDegree(FieldRef node) {
        return outgoing(node).size();
    }

    public int inDegree(FieldRef node) {
        return incoming(node).size();
    }

    /**
     * (in + out) / (n - 1); zero for a single-node graph.
     */
    public double degreeCentrality(FieldRef node) {
        int n = nodes.size();
        return n <= 1 ? 0.0 : (double) (inDegree(node) + outDegree(node)) / (n - 1);
    }

    /**
     * Up to {@code k} nodes by descending degree centrality, ties in node order.
     */
    public List<FieldRef> topByDegree(int k) {
        return nodes.stream()
                .sorted(Comparator.comparingDouble(this::degreeCentrality).reversed())
                .limit(Math.max(k, 0))
                .toList();
    }

    /**
     * Nodes with more than one outgoing edge.
     */
    public List<FieldRef> confounders() {
        return nodes.stream()
                .filter(n -> outDegree(n) > 1)
                .toList();
    }

    /**
     * All nodes reachable from {@code start}, excluding {@code start} itself.
     */
    public Set<FieldRef> descendants(FieldRef start) {
        Set<FieldRef> reached = new LinkedHashSet<>();
        spanningTree(start).forEach(edge -> reached.add(edge.target()));
        return reached;
    }

    /**
     * Edges of the breadth-first tree rooted at {@code start}, in visiting order.
     * Every descendant is the target of exactly one tree edge.
     */
    public List<CausalEdge> spanningTree(FieldRef start) {
        List<CausalEdge> tree = new ArrayList<>();
        Set<FieldRef> visited = new LinkedHashSet<>();
        Queue<FieldRef> queue = new ArrayDeque<>();
        visited.add(start);
        queue.add(start);

        while (!queue.isEmpty()) {
            FieldRef node = queue.poll();
            for (CausalEdge edge : outgoing(node)) {
                if (visited.add(edge.target())) {
                    tree.add(edge);
                    queue.add(edge.target());
                }
            }
        }
        return tree;
    }

    public Stats stats() {
        return new Stats(
                nodes.size(),
                outgoing.values().stream().mapToInt(List::size).sum(),
                confounders().size()
        );
    }

    public record Stats(int nodeCount, int edgeCount, int confounderCount) {}
}
