package com.story.analysis.statespace;

import com.story.analysis.graph.DirectedGraph;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Result of a frontier-merged exploration.
 *
 * @param graph                the quotient graph over state nodes
 * @param initialNode          the node of the initial scene and state
 * @param representativeStates for every node, the first concrete state that reached it
 * @param terminalNodes        nodes that were not expanded: depth limit, terminal scene, or no transitions
 * @param <S>                  scene identifier type
 * @param <T>                  concrete state type
 * @param <G>                  signature type
 * @param <L>                  label type
 */
public record FrontierMergedGraph<S, T, G, L>(
        DirectedGraph<StateNode<S, G>, L> graph,
        StateNode<S, G> initialNode,
        Map<StateNode<S, G>, T> representativeStates,
        Set<StateNode<S, G>> terminalNodes
) {

    /**
     * Returns the representative concrete state of {@code node}.
     */
    public Optional<T> representativeState(StateNode<S, G> node) {
        return Optional.ofNullable(representativeStates.get(node));
    }

    public boolean isTerminal(StateNode<S, G> node) {
        return terminalNodes.contains(node);
    }

    public int nodeCount() {
        return graph.nodeCount();
    }

    public int edgeCount() {
        return graph.edgeCount();
    }
}
