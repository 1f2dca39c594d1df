package com.story.analysis.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Breadth-first and depth-first traversals. Each node is visited at most once.
 */
public final class GraphSearch {

    private GraphSearch() {
    }

    /**
     * Returns the nodes reachable from {@code startNodes} in breadth-first order, without repeats.
     */
    public static <N, L> List<N> breadthFirst(Graph<N, L> graph, Iterable<N> startNodes) {
        Set<N> visited = new HashSet<>();
        Deque<N> queue = new ArrayDeque<>();
        List<N> order = new ArrayList<>();

        for (N start : startNodes) {
            if (visited.add(start)) {
                queue.addLast(start);
            }
        }

        while (!queue.isEmpty()) {
            N node = queue.pollFirst();
            order.add(node);
            for (N succ : graph.successors(node)) {
                if (visited.add(succ)) {
                    queue.addLast(succ);
                }
            }
        }
        return order;
    }

    /**
     * Returns the nodes reachable from {@code startNodes} in depth-first order, without repeats.
     * Successors are marked visited when pushed, so the order is the pre-order of an
     * iterative stack traversal.
     */
    public static <N, L> List<N> depthFirst(Graph<N, L> graph, Iterable<N> startNodes) {
        Set<N> visited = new HashSet<>();
        Deque<N> stack = new ArrayDeque<>();
        List<N> order = new ArrayList<>();

        for (N start : startNodes) {
            if (visited.add(start)) {
                stack.push(start);
            }
        }

        while (!stack.isEmpty()) {
            N node = stack.pop();
            order.add(node);
            for (N succ : graph.successors(node)) {
                if (visited.add(succ)) {
                    stack.push(succ);
                }
            }
        }
        return order;
    }

    /**
     * Returns the set of nodes reachable from {@code start}, including {@code start} itself.
     */
    public static <N, L> Set<N> reachableFrom(Graph<N, L> graph, N start) {
        return new HashSet<>(breadthFirst(graph, List.of(start)));
    }
}
