package com.story.analysis.consistency;

import com.story.analysis.scenario.Scenario;
import com.story.analysis.scenario.Scene;
import com.story.analysis.scenario.SceneTransition;
import com.story.analysis.scenario.TransitionType;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Request to evaluate the narrative consistency of one playthrough.
 *
 * @param scenarioId the scenario the path belongs to
 * @param path       the scene path
 * @param content    the playthrough text: scene contents in order, with the choices taken between them
 */
public record PathEvaluationRequest(String scenarioId, SelectedPath path, String content) {

    public PathEvaluationRequest {
        Objects.requireNonNull(scenarioId, "scenarioId is required");
        Objects.requireNonNull(path, "path is required");
        content = content != null ? content : "";
    }

    /**
     * Builds the playthrough text for {@code path}. Scenes are separated by a blank line and a
     * branch choice is written as {@code > choice} before the scene it leads to.
     */
    public static PathEvaluationRequest of(Scenario scenario, SelectedPath path) {
        Map<String, Scene> scenes = scenario.scenesById();
        StringBuilder content = new StringBuilder();
        List<String> sceneIds = path.sceneIds();

        for (int i = 0; i < sceneIds.size(); i++) {
            if (i > 0) {
                content.append("\n\n");
                SceneTransition transition = path.transitions().get(i - 1);
                if (transition.transitionType() == TransitionType.BRANCH && transition.choiceText() != null) {
                    content.append("> ").append(transition.choiceText()).append("\n\n");
                }
            }
            Scene scene = scenes.get(sceneIds.get(i));
            if (scene != null) {
                content.append(scene.getContent());
            }
        }
        return new PathEvaluationRequest(scenario.id(), path, content.toString());
    }
}
