package com.story.analysis.graph;

import java.util.List;

/**
 * Read-only view of a directed graph.
 * Queries on unknown nodes never fail; such nodes are treated as having no edges.
 *
 * @param <N> node type
 * @param <L> edge label type
 */
public interface Graph<N, L> {

    /**
     * Returns every node of the graph, including endpoints implied by edges.
     */
    List<N> nodes();

    /**
     * Returns every edge of the graph in construction order.
     */
    List<Edge<N, L>> edges();

    /**
     * Returns the edges leaving {@code node}, or an empty list.
     */
    List<Edge<N, L>> outgoingEdges(N node);

    /**
     * Returns the edges entering {@code node}, or an empty list.
     */
    List<Edge<N, L>> incomingEdges(N node);

    /**
     * Returns the targets of the edges leaving {@code node}.
     */
    List<N> successors(N node);

    /**
     * Returns the sources of the edges entering {@code node}.
     */
    List<N> predecessors(N node);

    default int outDegree(N node) {
        return outgoingEdges(node).size();
    }

    default int inDegree(N node) {
        return incomingEdges(node).size();
    }

    /**
     * Returns all nodes with in-degree zero.
     */
    List<N> roots();

    /**
     * Returns all nodes with out-degree zero.
     */
    List<N> terminals();

    /**
     * Returns true if the node is part of this graph.
     */
    boolean containsNode(N node);
}
