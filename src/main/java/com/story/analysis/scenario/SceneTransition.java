package com.story.analysis.scenario;

/**
 * Edge label of a scenario graph.
 *
 * @param fromSceneId    source scene
 * @param toSceneId      target scene
 * @param transitionType linear progression or branch
 * @param choiceText     the branch choice text; {@code null} for linear transitions
 */
public record SceneTransition(String fromSceneId, String toSceneId, TransitionType transitionType, String choiceText) {

    public static SceneTransition linear(String fromSceneId, String toSceneId) {
        return new SceneTransition(fromSceneId, toSceneId, TransitionType.LINEAR, null);
    }

    public static SceneTransition branch(String fromSceneId, String toSceneId, String choiceText) {
        return new SceneTransition(fromSceneId, toSceneId, TransitionType.BRANCH, choiceText);
    }

    @Override
    public String toString() {
        return transitionType == TransitionType.BRANCH ? "choice:" + choiceText : "next";
    }
}
