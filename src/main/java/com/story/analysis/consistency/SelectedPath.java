package com.story.analysis.consistency;

import com.story.analysis.scenario.SceneTransition;

import java.util.List;

/**
 * A scene path chosen for evaluation, with the transitions taken between consecutive scenes.
 *
 * @param sceneIds    scene ids in play order
 * @param transitions transitions between consecutive scenes; one fewer than {@code sceneIds}
 */
public record SelectedPath(List<String> sceneIds, List<SceneTransition> transitions) {

    public SelectedPath {
        sceneIds = List.copyOf(sceneIds);
        transitions = transitions != null ? List.copyOf(transitions) : List.of();
        if (sceneIds.isEmpty()) {
            throw new IllegalArgumentException("sceneIds must not be empty");
        }
        if (transitions.size() != sceneIds.size() - 1) {
            throw new IllegalArgumentException("transitions must connect consecutive scenes");
        }
    }

    public String firstSceneId() {
        return sceneIds.get(0);
    }

    public String lastSceneId() {
        return sceneIds.get(sceneIds.size() - 1);
    }

    public int length() {
        return sceneIds.size();
    }
}
