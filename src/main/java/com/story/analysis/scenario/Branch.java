package com.story.analysis.scenario;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A labelled player choice leading out of a scene.
 *
 * @param choice      the choice text shown to the player
 * @param nextSceneId the scene the choice leads to; {@code null} or blank when it leads nowhere
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Branch(
        @JsonProperty("choice") String choice,
        @JsonProperty("next_scene_id") String nextSceneId
) {

    /**
     * Returns true if this branch points to a scene.
     */
    public boolean hasTarget() {
        return nextSceneId != null && !nextSceneId.isBlank();
    }
}
