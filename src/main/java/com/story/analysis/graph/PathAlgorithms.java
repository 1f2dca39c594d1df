package com.story.analysis.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Path enumeration and path compression over directed graphs.
 *
 * <p>Enumeration is depth-first and lazy: paths are produced one at a time as the returned
 * {@link Iterable} is consumed, so callers can stop after a bounded number of paths.
 * A node already on the current path is never entered again, so cyclic graphs terminate.</p>
 */
public final class PathAlgorithms {

    /** Depth value meaning "no depth limit". */
    public static final int UNBOUNDED = -1;

    private PathAlgorithms() {
    }

    /**
     * Enumerates paths from {@code start} to nodes with no outgoing edges.
     */
    public static <N, L> Iterable<List<N>> enumeratePaths(Graph<N, L> graph, N start) {
        return enumeratePaths(graph, start, null, UNBOUNDED);
    }

    /**
     * Enumerates paths from {@code start} to nodes accepted by {@code isTerminal}.
     */
    public static <N, L> Iterable<List<N>> enumeratePaths(Graph<N, L> graph, N start, Predicate<N> isTerminal) {
        return enumeratePaths(graph, start, isTerminal, UNBOUNDED);
    }

    /**
     * Enumerates paths from {@code start}.
     *
     * <p>A path is reported when its last node is accepted by {@code isTerminal} or when it has
     * reached {@code maxDepth} edges; in the latter case the reported path is truncated and its
     * last node need not be terminal. Paths that dead-end on a non-terminal node are dropped.</p>
     *
     * @param graph      the graph to explore
     * @param start      the first node of every path
     * @param isTerminal terminal predicate, {@code null} for "out-degree is zero"
     * @param maxDepth   maximum number of edges per path, or {@link #UNBOUNDED}
     * @return a lazily evaluated sequence of node paths
     */
    public static <N, L> Iterable<List<N>> enumeratePaths(Graph<N, L> graph,
                                                          N start,
                                                          Predicate<N> isTerminal,
                                                          int maxDepth) {
        Objects.requireNonNull(graph, "graph is required");
        Objects.requireNonNull(start, "start is required");
        if (maxDepth < UNBOUNDED) {
            throw new IllegalArgumentException("maxDepth must be >= 0 or UNBOUNDED");
        }
        Predicate<N> terminal = isTerminal != null ? isTerminal : node -> graph.outDegree(node) == 0;
        return () -> new PathIterator<>(graph, start, terminal, maxDepth);
    }

    /**
     * Compresses paths by trimming redundant shared suffixes.
     *
     * <p>Paths are inserted, back to front, into a suffix trie. When a path runs into a trie
     * node owned by an earlier path, at a shared suffix of at least two nodes that is shorter
     * than the path itself, and the two paths differ somewhere before the join point, the later
     * path is cut just after the join point. Identical trimmed prefixes are reported once.</p>
     */
    public static <N> List<List<N>> compressBySharedSuffixes(List<List<N>> paths) {
        if (paths.isEmpty()) {
            return List.of();
        }

        int[] keepLength = new int[paths.size()];
        for (int i = 0; i < paths.size(); i++) {
            keepLength[i] = paths.get(i).size();
        }

        TrieNode<N> root = new TrieNode<>();
        for (int p = 0; p < paths.size(); p++) {
            List<N> path = paths.get(p);
            int length = path.size();
            TrieNode<N> node = root;
            int matchedDepth = 0;

            for (int i = length - 1; i >= 0; i--) {
                node = node.children.computeIfAbsent(path.get(i), k -> new TrieNode<>());
                matchedDepth++;

                if (node.ownerPathIndex == -1) {
                    node.ownerPathIndex = p;
                } else if (node.ownerPathIndex != p && matchedDepth >= 2 && matchedDepth < length) {
                    List<N> owner = paths.get(node.ownerPathIndex);
                    if (!samePrefix(path, owner, i) && i + 1 < keepLength[p]) {
                        keepLength[p] = i + 1;
                    }
                }
            }
        }

        Set<List<N>> seen = new LinkedHashSet<>();
        for (int p = 0; p < paths.size(); p++) {
            int length = keepLength[p];
            if (length > 0) {
                seen.add(List.copyOf(paths.get(p).subList(0, length)));
            }
        }
        return List.copyOf(seen);
    }

    /**
     * Enumerates all paths from {@code root}, compresses them by shared suffixes and maps each
     * compressed node path back to the edges it traverses.
     *
     * @throws IllegalStateException if a compressed path contains a step with no matching edge
     */
    public static <N, L> List<List<Edge<N, L>>> compressGraphPathsToEdgePaths(Graph<N, L> graph,
                                                                            N root,
                                                                            Predicate<N> isTerminal,
                                                                            int maxDepth) {
        List<List<N>> nodePaths = new ArrayList<>();
        for (List<N> path : enumeratePaths(graph, root, isTerminal, maxDepth)) {
            nodePaths.add(path);
        }
        List<List<Edge<N, L>>> result = new ArrayList<>();
        for (List<N> nodePath : compressBySharedSuffixes(nodePaths)) {
            result.add(toEdgePath(graph, nodePath));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Maps a node path to its edges, choosing the first outgoing edge to the next node at every step.
     * Paths with fewer than two nodes map to an empty edge path.
     *
     * @throws IllegalStateException if two consecutive nodes are not connected
     */
    public static <N, L> List<Edge<N, L>> toEdgePath(Graph<N, L> graph, List<N> nodePath) {
        if (nodePath.size() < 2) {
            return List.of();
        }
        List<Edge<N, L>> edgePath = new ArrayList<>(nodePath.size() - 1);
        for (int i = 0; i < nodePath.size() - 1; i++) {
            N from = nodePath.get(i);
            N to = nodePath.get(i + 1);
            Edge<N, L> chosen = null;
            for (Edge<N, L> edge : graph.outgoingEdges(from)) {
                if (edge.to().equals(to)) {
                    chosen = edge;
                    break;
                }
            }
            if (chosen == null) {
                throw new IllegalStateException(
                        "No edge from '" + from + "' to '" + to + "' while reconstructing edge path");
            }
            edgePath.add(chosen);
        }
        return Collections.unmodifiableList(edgePath);
    }

    private static <N> boolean samePrefix(List<N> a, List<N> b, int lastIndex) {
        if (a.size() <= lastIndex || b.size() <= lastIndex) {
            return false;
        }
        for (int k = 0; k <= lastIndex; k++) {
            if (!Objects.equals(a.get(k), b.get(k))) {
                return false;
            }
        }
        return true;
    }

    private static final class TrieNode<N> {
        private final Map<N, TrieNode<N>> children = new HashMap<>();
        private int ownerPathIndex = -1;
    }

    private record Frame<N>(N node, Iterator<N> successors, int depth) {}

    /**
     * Iterative depth-first walker; yields a path each time a terminal node or the depth limit is reached.
     */
    private static final class PathIterator<N, L> implements Iterator<List<N>> {
        private final Graph<N, L> graph;
        private final Predicate<N> isTerminal;
        private final int maxDepth;
        private final Deque<Frame<N>> stack = new ArrayDeque<>();
        private final List<N> path = new ArrayList<>();
        private final Set<N> onPath = new HashSet<>();
        private List<N> next;

        PathIterator(Graph<N, L> graph, N start, Predicate<N> isTerminal, int maxDepth) {
            this.graph = graph;
            this.isTerminal = isTerminal;
            this.maxDepth = maxDepth;
            push(start, 0);
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public List<N> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            List<N> result = next;
            next = null;
            return result;
        }

        private List<N> advance() {
            while (!stack.isEmpty()) {
                Frame<N> frame = stack.peek();
                boolean depthReached = maxDepth != UNBOUNDED && frame.depth() >= maxDepth;

                if (depthReached || isTerminal.test(frame.node())) {
                    List<N> found = List.copyOf(path);
                    pop();
                    return found;
                }

                if (!frame.successors().hasNext()) {
                    pop();
                    continue;
                }

                N child = frame.successors().next();
                if (!onPath.contains(child)) {
                    push(child, frame.depth() + 1);
                }
            }
            return null;
        }

        private void push(N node, int depth) {
            path.add(node);
            onPath.add(node);
            stack.push(new Frame<>(node, graph.successors(node).iterator(), depth));
        }

        private void pop() {
            Frame<N> frame = stack.pop();
            path.remove(path.size() - 1);
            onPath.remove(frame.node());
        }
    }
}
