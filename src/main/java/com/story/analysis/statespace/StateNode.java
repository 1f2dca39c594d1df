package com.story.analysis.statespace;

import java.util.Objects;

/**
 * Vertex of a frontier-merged graph: a scene together with the abstract signature of the
 * narrative state at that scene. Concrete states with equal signatures at the same scene
 * collapse into one node.
 *
 * @param sceneId   the scene
 * @param signature abstract state signature
 * @param <S>       scene identifier type
 * @param <G>       signature type
 */
public record StateNode<S, G>(S sceneId, G signature) {

    public StateNode {
        Objects.requireNonNull(sceneId, "sceneId is required");
        Objects.requireNonNull(signature, "signature is required");
    }

    @Override
    public String toString() {
        return sceneId + "#" + signature;
    }
}
