package com.story.analysis.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Topological ordering and cycle detection.
 */
public final class GraphSort {

    private GraphSort() {
    }

    /**
     * Computes a topological order using Kahn's algorithm.
     *
     * @throws IllegalStateException if the graph contains a directed cycle
     */
    public static <N, L> List<N> topologicalSort(Graph<N, L> graph) {
        Map<N, Integer> inDegree = new HashMap<>();
        Deque<N> queue = new ArrayDeque<>();
        for (N node : graph.nodes()) {
            int degree = graph.inDegree(node);
            inDegree.put(node, degree);
            if (degree == 0) {
                queue.addLast(node);
            }
        }

        List<N> result = new ArrayList<>(graph.nodes().size());
        while (!queue.isEmpty()) {
            N node = queue.pollFirst();
            result.add(node);
            for (N succ : graph.successors(node)) {
                int remaining = inDegree.merge(succ, -1, Integer::sum);
                if (remaining == 0) {
                    queue.addLast(succ);
                }
            }
        }

        if (result.size() != graph.nodes().size()) {
            throw new IllegalStateException("Graph contains at least one cycle");
        }
        return result;
    }

    /**
     * Returns true if the graph contains at least one directed cycle (self-loops included).
     */
    public static <N, L> boolean hasCycle(Graph<N, L> graph) {
        try {
            topologicalSort(graph);
            return false;
        } catch (IllegalStateException e) {
            return true;
        }
    }
}
