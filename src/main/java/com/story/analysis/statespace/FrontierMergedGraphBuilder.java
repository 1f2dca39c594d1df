package com.story.analysis.statespace;

import com.story.analysis.graph.DirectedGraph;
import com.story.analysis.graph.Edge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Builds frontier-merged state-space graphs.
 *
 * <p>Exploration is breadth-first from an initial scene and concrete state. Every concrete
 * state is projected to a {@link StateNode} through the caller's signature function; the
 * first concrete state reaching a node becomes its representative and is the only one
 * expanded from it. Later states that map to a known node contribute an edge but are not
 * explored further. The graph therefore has at most one node per distinct
 * {@code (scene, signature)} pair reachable within the depth limit.</p>
 *
 * <p>Termination is the caller's responsibility: with no depth limit and no terminal
 * predicate, a transition function that keeps producing new signatures never finishes.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * FrontierMergedGraph&lt;String, State, Sig, String&gt; result = FrontierMergedGraphBuilder
 *     .&lt;String, State, Sig, String&gt;from("intro", State.initial())
 *     .transitions((scene, state) -&gt; nextSteps(scene, state))
 *     .signature(State::signature)
 *     .terminalWhen(endings::contains)
 *     .maxDepth(40)
 *     .build();
 * </pre>
 *
 * @param <S> scene identifier type
 * @param <T> concrete state type
 * @param <G> signature type
 * @param <L> edge label type
 */
public final class FrontierMergedGraphBuilder<S, T, G, L> {
    private static final Logger log = LoggerFactory.getLogger(FrontierMergedGraphBuilder.class);

    private final S initialSceneId;
    private final T initialState;
    private TransitionFunction<S, T, L> transitionFunction;
    private Function<? super T, ? extends G> signatureFunction;
    private Predicate<? super S> terminalScene = scene -> false;
    private Integer maxDepth;

    private FrontierMergedGraphBuilder(S initialSceneId, T initialState) {
        this.initialSceneId = Objects.requireNonNull(initialSceneId, "initialSceneId is required");
        this.initialState = initialState;
    }

    /**
     * Starts a builder exploring from {@code initialSceneId} in {@code initialState}.
     */
    public static <S, T, G, L> FrontierMergedGraphBuilder<S, T, G, L> from(S initialSceneId, T initialState) {
        return new FrontierMergedGraphBuilder<>(initialSceneId, initialState);
    }

    public FrontierMergedGraphBuilder<S, T, G, L> transitions(TransitionFunction<S, T, L> transitionFunction) {
        this.transitionFunction = transitionFunction;
        return this;
    }

    public FrontierMergedGraphBuilder<S, T, G, L> signature(Function<? super T, ? extends G> signatureFunction) {
        this.signatureFunction = signatureFunction;
        return this;
    }

    /**
     * Scenes matching {@code terminalScene} are recorded as terminal and never expanded.
     */
    public FrontierMergedGraphBuilder<S, T, G, L> terminalWhen(Predicate<? super S> terminalScene) {
        this.terminalScene = terminalScene != null ? terminalScene : scene -> false;
        return this;
    }

    /**
     * Nodes first reached at {@code maxDepth} steps from the initial node are recorded as terminal.
     */
    public FrontierMergedGraphBuilder<S, T, G, L> maxDepth(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be non-negative");
        }
        this.maxDepth = maxDepth;
        return this;
    }

    /**
     * Removes any depth limit.
     */
    public FrontierMergedGraphBuilder<S, T, G, L> unboundedDepth() {
        this.maxDepth = null;
        return this;
    }

    /**
     * Explores the state space and returns the merged graph.
     */
    public FrontierMergedGraph<S, T, G, L> build() {
        Objects.requireNonNull(transitionFunction, "transition function is required");
        Objects.requireNonNull(signatureFunction, "signature function is required");

        Set<StateNode<S, G>> nodes = new LinkedHashSet<>();
        List<Edge<StateNode<S, G>, L>> edges = new ArrayList<>();
        Map<StateNode<S, G>, T> representatives = new LinkedHashMap<>();
        Set<StateNode<S, G>> terminals = new LinkedHashSet<>();
        Deque<Pending<S, T, G>> queue = new ArrayDeque<>();

        StateNode<S, G> initialNode = new StateNode<>(initialSceneId, signatureFunction.apply(initialState));
        nodes.add(initialNode);
        representatives.put(initialNode, initialState);
        queue.addLast(new Pending<>(initialNode, initialState, 0));

        while (!queue.isEmpty()) {
            Pending<S, T, G> current = queue.pollFirst();
            StateNode<S, G> currentNode = current.node();

            if (maxDepth != null && current.depth() >= maxDepth) {
                terminals.add(currentNode);
                continue;
            }
            if (terminalScene.test(currentNode.sceneId())) {
                terminals.add(currentNode);
                continue;
            }

            Iterable<StateTransition<S, L, T>> outgoing =
                    transitionFunction.transitions(currentNode.sceneId(), current.state());
            boolean any = false;
            if (outgoing != null) {
                for (StateTransition<S, L, T> transition : outgoing) {
                    any = true;
                    StateNode<S, G> nextNode = new StateNode<>(
                            transition.toScene(), signatureFunction.apply(transition.nextState()));
                    if (nodes.add(nextNode)) {
                        representatives.put(nextNode, transition.nextState());
                        queue.addLast(new Pending<>(nextNode, transition.nextState(), current.depth() + 1));
                    }
                    edges.add(new Edge<>(currentNode, nextNode, transition.label()));
                }
            }
            if (!any) {
                terminals.add(currentNode);
            }
        }

        DirectedGraph<StateNode<S, G>, L> graph = DirectedGraph.fromEdges(edges, nodes);
        log.debug("statespace.completed initial={} nodes={} edges={} terminals={}",
                initialNode, graph.nodeCount(), graph.edgeCount(), terminals.size());

        return new FrontierMergedGraph<>(
                graph,
                initialNode,
                Collections.unmodifiableMap(representatives),
                Collections.unmodifiableSet(terminals));
    }

    private record Pending<S, T, G>(StateNode<S, G> node, T state, int depth) {}
}
