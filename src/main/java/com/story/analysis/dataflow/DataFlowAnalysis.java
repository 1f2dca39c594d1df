package com.story.analysis.dataflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Forward dataflow analyses over explicit node/link descriptions.
 *
 * <p>Pure functions over their arguments: every run works on its own queue and result map,
 * so independent analyses may run concurrently over the same input.</p>
 */
public final class DataFlowAnalysis {
    private static final Logger log = LoggerFactory.getLogger(DataFlowAnalysis.class);

    private DataFlowAnalysis() {
    }

    /**
     * Computes, for every node, the entities that must have been introduced on every path
     * from {@code startId} to that node.
     *
     * <p>Meet is set intersection over the predecessors' current results; transfer is
     * {@code (meet ∪ introduced) − removed}. The start node is pinned to its own transfer of
     * the empty set, even when it has predecessors through a loop. Any other node without
     * predecessors gets its own local transfer of the empty set. Predecessor and successor
     * ids missing from {@code nodes} are skipped.</p>
     *
     * <p>The worklist is seeded with the start node and its direct successors. Nodes that
     * are never scheduled keep an empty result, so the answer is relative to {@code startId}
     * and not a whole-graph fixpoint.</p>
     *
     * @param nodes   every node, keyed by id
     * @param startId the designated start node
     * @return a map from every node id in {@code nodes} to its must-introduced set
     * @throws IllegalArgumentException if {@code startId} is not a key of {@code nodes}
     */
    public static <N, E> Map<N, Set<E>> computeMustIntroducedSets(Map<N, DataFlowNode<N, E>> nodes, N startId) {
        Objects.requireNonNull(nodes, "nodes is required");
        DataFlowNode<N, E> startNode = startId != null ? nodes.get(startId) : null;
        if (startNode == null) {
            throw new IllegalArgumentException("Start node '" + startId + "' not found in node set");
        }

        Map<N, Set<E>> must = new LinkedHashMap<>();
        for (N id : nodes.keySet()) {
            must.put(id, Set.of());
        }
        Set<E> startMust = startNode.transfer(Set.of());
        must.put(startId, startMust);

        Deque<N> worklist = new ArrayDeque<>();
        Set<N> inQueue = new HashSet<>();
        worklist.addLast(startId);
        inQueue.add(startId);
        for (N succId : startNode.successorIds()) {
            if (nodes.containsKey(succId) && inQueue.add(succId)) {
                worklist.addLast(succId);
            }
        }

        int iterations = 0;
        while (!worklist.isEmpty()) {
            N id = worklist.pollFirst();
            inQueue.remove(id);
            iterations++;

            DataFlowNode<N, E> node = nodes.get(id);
            Set<E> newMust;
            if (id.equals(startId)) {
                // back-edges into the start are ignored: nothing is guaranteed before the first scene
                newMust = startMust;
            } else if (node.predecessorIds().isEmpty()) {
                newMust = node.transfer(Set.of());
            } else {
                newMust = node.transfer(meet(nodes, must, node));
            }

            if (!newMust.equals(must.get(id))) {
                must.put(id, newMust);
                for (N succId : node.successorIds()) {
                    if (nodes.containsKey(succId) && inQueue.add(succId)) {
                        worklist.addLast(succId);
                    }
                }
            }
        }

        log.debug("dataflow.mustIntroduced.completed nodes={} iterations={}", nodes.size(), iterations);

        Map<N, Set<E>> result = new LinkedHashMap<>();
        must.forEach((id, set) -> result.put(id, Collections.unmodifiableSet(set)));
        return Collections.unmodifiableMap(result);
    }

    /**
     * Intersection of the current results of every known predecessor; empty when none is known.
     */
    private static <N, E> Set<E> meet(Map<N, DataFlowNode<N, E>> nodes, Map<N, Set<E>> must, DataFlowNode<N, E> node) {
        Set<E> result = null;
        for (N predId : node.predecessorIds()) {
            if (!nodes.containsKey(predId)) {
                continue;
            }
            Set<E> predMust = must.get(predId);
            if (result == null) {
                result = new LinkedHashSet<>(predMust);
            } else {
                result.retainAll(predMust);
            }
        }
        return result != null ? result : Set.of();
    }
}
