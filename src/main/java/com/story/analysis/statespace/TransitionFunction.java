package com.story.analysis.statespace;

/**
 * Produces the outgoing transitions of a concrete state at a scene.
 * Returning {@code null} or an empty sequence marks the state as terminal.
 *
 * @param <S> scene identifier type
 * @param <T> concrete state type
 * @param <L> label type
 */
@FunctionalInterface
public interface TransitionFunction<S, T, L> {

    Iterable<StateTransition<S, L, T>> transitions(S sceneId, T state);
}
