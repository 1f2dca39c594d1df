package com.story.analysis.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Dominator tree of a graph rooted at a start node.
 *
 * <p>Node {@code d} dominates node {@code n} when every path from the start to {@code n}
 * passes through {@code d}. The immediate dominator of {@code n} is its closest strict
 * dominator. Computed with the iterative algorithm of Cooper, Harvey and Kennedy over a
 * reverse post-order of the nodes reachable from the start.</p>
 *
 * <p>The start node and unreachable nodes have no immediate dominator.</p>
 *
 * @param <N> node type
 */
public final class Dominators<N> {

    private final N start;
    private final Map<N, N> immediateDominators;
    private final Map<N, Integer> reversePostOrder;

    private Dominators(N start, Map<N, N> immediateDominators, Map<N, Integer> reversePostOrder) {
        this.start = start;
        this.immediateDominators = immediateDominators;
        this.reversePostOrder = reversePostOrder;
    }

    /**
     * Computes the dominator tree of {@code graph} rooted at {@code start}.
     *
     * @throws IllegalArgumentException if {@code start} is not a node of the graph
     */
    public static <N, L> Dominators<N> compute(Graph<N, L> graph, N start) {
        Objects.requireNonNull(graph, "graph is required");
        Objects.requireNonNull(start, "start is required");
        if (!graph.containsNode(start)) {
            throw new IllegalArgumentException("Start node '" + start + "' not found in graph");
        }

        List<N> order = reversePostOrder(graph, start);
        Map<N, Integer> index = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            index.put(order.get(i), i);
        }

        int[] idom = new int[order.size()];
        Arrays.fill(idom, -1);
        idom[0] = 0;

        boolean changed = true;
        while (changed) {
            changed = false;
            for (int b = 1; b < order.size(); b++) {
                int newIdom = -1;
                for (N pred : graph.predecessors(order.get(b))) {
                    Integer p = index.get(pred);
                    if (p == null || idom[p] == -1) {
                        continue;
                    }
                    newIdom = newIdom == -1 ? p : intersect(idom, p, newIdom);
                }
                if (newIdom != -1 && idom[b] != newIdom) {
                    idom[b] = newIdom;
                    changed = true;
                }
            }
        }

        Map<N, N> result = new LinkedHashMap<>();
        for (int b = 1; b < order.size(); b++) {
            if (idom[b] != -1) {
                result.put(order.get(b), order.get(idom[b]));
            }
        }
        return new Dominators<>(start, Collections.unmodifiableMap(result), Collections.unmodifiableMap(index));
    }

    public N start() {
        return start;
    }

    /**
     * Returns the immediate dominator of {@code node}, or empty for the start node and unreachable nodes.
     */
    public Optional<N> immediateDominator(N node) {
        return Optional.ofNullable(immediateDominators.get(node));
    }

    /**
     * Returns the immediate dominator of every reachable node other than the start.
     */
    public Map<N, N> immediateDominators() {
        return immediateDominators;
    }

    /**
     * Returns true if {@code node} is reachable from the start.
     */
    public boolean isReachable(N node) {
        return reversePostOrder.containsKey(node);
    }

    /**
     * Returns true if {@code dominator} dominates {@code node}. Every reachable node dominates itself.
     */
    public boolean dominates(N dominator, N node) {
        if (!isReachable(node) || !isReachable(dominator)) {
            return false;
        }
        N current = node;
        while (current != null) {
            if (current.equals(dominator)) {
                return true;
            }
            current = immediateDominators.get(current);
        }
        return false;
    }

    /**
     * Returns the dominator chain from the start to {@code target}, both included.
     * Every path from the start to {@code target} visits these nodes in this order.
     * Empty if {@code target} is unreachable.
     */
    public List<N> dominatorPath(N target) {
        if (!isReachable(target)) {
            return List.of();
        }
        List<N> chain = new ArrayList<>();
        N current = target;
        while (current != null) {
            chain.add(current);
            current = immediateDominators.get(current);
        }
        Collections.reverse(chain);
        return Collections.unmodifiableList(chain);
    }

    private static int intersect(int[] idom, int a, int b) {
        int finger1 = a;
        int finger2 = b;
        while (finger1 != finger2) {
            while (finger1 > finger2) {
                finger1 = idom[finger1];
            }
            while (finger2 > finger1) {
                finger2 = idom[finger2];
            }
        }
        return finger1;
    }

    private static <N, L> List<N> reversePostOrder(Graph<N, L> graph, N start) {
        List<N> postOrder = new ArrayList<>();
        Set<N> visited = new HashSet<>();
        Deque<Map.Entry<N, Iterator<N>>> stack = new ArrayDeque<>();

        visited.add(start);
        stack.push(Map.entry(start, graph.successors(start).iterator()));
        while (!stack.isEmpty()) {
            Map.Entry<N, Iterator<N>> top = stack.peek();
            if (top.getValue().hasNext()) {
                N succ = top.getValue().next();
                if (visited.add(succ)) {
                    stack.push(Map.entry(succ, graph.successors(succ).iterator()));
                }
            } else {
                postOrder.add(top.getKey());
                stack.pop();
            }
        }
        Collections.reverse(postOrder);
        return postOrder;
    }
}
