package com.story.analysis.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable directed graph over a set of nodes and labelled edges.
 *
 * <p>Built once via {@link #fromEdges(Iterable)} (optionally with an explicit node collection
 * and a {@link NodeEquivalence}) and never mutated afterwards. Outgoing and incoming edge
 * indices are computed at construction time, so every query is a read over precomputed lists.
 * Instances are safe to share between threads.</p>
 *
 * <p>Every endpoint of every edge is a node of the graph. Nodes passed explicitly are kept
 * even when no edge references them. Node order is first-seen order: explicit nodes first,
 * then edge endpoints in edge order.</p>
 *
 * @param <N> node type
 * @param <L> edge label type
 */
public final class DirectedGraph<N, L> implements Graph<N, L> {

    private final NodeEquivalence<N> equivalence;
    private final List<N> nodes;
    private final List<Edge<N, L>> edges;
    private final Map<NodeKey<N>, List<Edge<N, L>>> outgoing;
    private final Map<NodeKey<N>, List<Edge<N, L>>> incoming;

    private DirectedGraph(NodeEquivalence<N> equivalence,
                          List<N> nodes,
                          List<Edge<N, L>> edges,
                          Map<NodeKey<N>, List<Edge<N, L>>> outgoing,
                          Map<NodeKey<N>, List<Edge<N, L>>> incoming) {
        this.equivalence = equivalence;
        this.nodes = nodes;
        this.edges = edges;
        this.outgoing = outgoing;
        this.incoming = incoming;
    }

    /**
     * Builds a graph from edges alone.
     */
    public static <N, L> DirectedGraph<N, L> fromEdges(Iterable<Edge<N, L>> edges) {
        return fromEdges(edges, null, null);
    }

    /**
     * Builds a graph from edges plus an explicit node collection.
     */
    public static <N, L> DirectedGraph<N, L> fromEdges(Iterable<Edge<N, L>> edges, Iterable<N> nodes) {
        return fromEdges(edges, nodes, null);
    }

    /**
     * Builds a graph from edges, an optional explicit node collection and an optional node equivalence.
     *
     * @param edges       the edges of the graph
     * @param nodes       additional nodes to include, may be {@code null}
     * @param equivalence node equality, {@code null} for natural equality
     * @return the immutable graph
     */
    public static <N, L> DirectedGraph<N, L> fromEdges(Iterable<Edge<N, L>> edges,
                                                       Iterable<N> nodes,
                                                       NodeEquivalence<N> equivalence) {
        Objects.requireNonNull(edges, "edges is required");
        NodeEquivalence<N> eq = equivalence != null ? equivalence : NodeEquivalence.natural();

        // Key -> representative node, in first-seen order
        Map<NodeKey<N>, N> nodeIndex = new LinkedHashMap<>();
        if (nodes != null) {
            for (N node : nodes) {
                Objects.requireNonNull(node, "nodes must not contain null");
                nodeIndex.putIfAbsent(new NodeKey<>(node, eq), node);
            }
        }

        List<Edge<N, L>> edgeList = new ArrayList<>();
        for (Edge<N, L> edge : edges) {
            N from = nodeIndex.computeIfAbsent(new NodeKey<>(edge.from(), eq), k -> edge.from());
            N to = nodeIndex.computeIfAbsent(new NodeKey<>(edge.to(), eq), k -> edge.to());
            // Rewrite endpoints to the representative instance for non-natural equivalences
            if (from != edge.from() || to != edge.to()) {
                edgeList.add(new Edge<>(from, to, edge.label()));
            } else {
                edgeList.add(edge);
            }
        }

        Map<NodeKey<N>, List<Edge<N, L>>> out = new LinkedHashMap<>();
        Map<NodeKey<N>, List<Edge<N, L>>> in = new LinkedHashMap<>();
        for (NodeKey<N> key : nodeIndex.keySet()) {
            out.put(key, new ArrayList<>());
            in.put(key, new ArrayList<>());
        }
        for (Edge<N, L> edge : edgeList) {
            out.get(new NodeKey<>(edge.from(), eq)).add(edge);
            in.get(new NodeKey<>(edge.to(), eq)).add(edge);
        }

        Map<NodeKey<N>, List<Edge<N, L>>> roOut = new LinkedHashMap<>();
        out.forEach((k, v) -> roOut.put(k, Collections.unmodifiableList(v)));
        Map<NodeKey<N>, List<Edge<N, L>>> roIn = new LinkedHashMap<>();
        in.forEach((k, v) -> roIn.put(k, Collections.unmodifiableList(v)));

        return new DirectedGraph<>(
                eq,
                Collections.unmodifiableList(new ArrayList<>(nodeIndex.values())),
                Collections.unmodifiableList(edgeList),
                Collections.unmodifiableMap(roOut),
                Collections.unmodifiableMap(roIn));
    }

    @Override
    public List<N> nodes() {
        return nodes;
    }

    @Override
    public List<Edge<N, L>> edges() {
        return edges;
    }

    @Override
    public List<Edge<N, L>> outgoingEdges(N node) {
        return lookup(outgoing, node);
    }

    @Override
    public List<Edge<N, L>> incomingEdges(N node) {
        return lookup(incoming, node);
    }

    @Override
    public List<N> successors(N node) {
        List<Edge<N, L>> out = outgoingEdges(node);
        List<N> result = new ArrayList<>(out.size());
        for (Edge<N, L> edge : out) {
            result.add(edge.to());
        }
        return result;
    }

    @Override
    public List<N> predecessors(N node) {
        List<Edge<N, L>> in = incomingEdges(node);
        List<N> result = new ArrayList<>(in.size());
        for (Edge<N, L> edge : in) {
            result.add(edge.from());
        }
        return result;
    }

    @Override
    public List<N> roots() {
        List<N> result = new ArrayList<>();
        for (N node : nodes) {
            if (inDegree(node) == 0) {
                result.add(node);
            }
        }
        return result;
    }

    @Override
    public List<N> terminals() {
        List<N> result = new ArrayList<>();
        for (N node : nodes) {
            if (outDegree(node) == 0) {
                result.add(node);
            }
        }
        return result;
    }

    @Override
    public boolean containsNode(N node) {
        return node != null && outgoing.containsKey(new NodeKey<>(node, equivalence));
    }

    /**
     * Returns the number of nodes.
     */
    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Returns the number of edges.
     */
    public int edgeCount() {
        return edges.size();
    }

    private List<Edge<N, L>> lookup(Map<NodeKey<N>, List<Edge<N, L>>> index, N node) {
        if (node == null) {
            return List.of();
        }
        List<Edge<N, L>> list = index.get(new NodeKey<>(node, equivalence));
        return list != null ? list : List.of();
    }

    @Override
    public String toString() {
        return "DirectedGraph{" +
                "nodes=" + nodes.size() +
                ", edges=" + edges.size() +
                '}';
    }

    /**
     * Hash key applying the graph's node equivalence.
     */
    private static final class NodeKey<N> {
        private final N node;
        private final NodeEquivalence<N> equivalence;

        NodeKey(N node, NodeEquivalence<N> equivalence) {
            this.node = node;
            this.equivalence = equivalence;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof NodeKey<?> other)) return false;
            @SuppressWarnings("unchecked")
            N otherNode = (N) other.node;
            return equivalence.equivalent(node, otherNode);
        }

        @Override
        public int hashCode() {
            return equivalence.hash(node);
        }
    }
}
