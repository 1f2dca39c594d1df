package com.story.analysis.statespace;

import java.util.Objects;

/**
 * One step of concrete state-space exploration, produced on demand by a {@link TransitionFunction}.
 *
 * @param toScene   the scene reached
 * @param label     edge label for the step
 * @param nextState the concrete state after the step
 * @param <S>       scene identifier type
 * @param <L>       label type
 * @param <T>       concrete state type
 */
public record StateTransition<S, L, T>(S toScene, L label, T nextState) {

    public StateTransition {
        Objects.requireNonNull(toScene, "toScene is required");
    }
}
