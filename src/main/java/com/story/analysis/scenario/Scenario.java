package com.story.analysis.scenario;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A branching story: an identifier, a title and its scenes in declaration order.
 * Read-only input to the analyses.
 *
 * @param id     scenario identifier
 * @param title  display title
 * @param scenes the scenes; the first one is the fallback start scene
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Scenario(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("scenes") List<Scene> scenes
) {
    public Scenario {
        Objects.requireNonNull(id, "id is required");
        title = title != null ? title : "";
        scenes = scenes != null ? List.copyOf(scenes) : List.of();
    }

    public static Scenario of(String id, Scene... scenes) {
        return new Scenario(id, id, List.of(scenes));
    }

    /**
     * Returns the scene with the given id, if declared.
     */
    public Optional<Scene> scene(String sceneId) {
        for (Scene scene : scenes) {
            if (scene.getId().equals(sceneId)) {
                return Optional.of(scene);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the scenes keyed by id, in declaration order. When an id is declared twice the first scene wins.
     */
    public Map<String, Scene> scenesById() {
        Map<String, Scene> byId = new LinkedHashMap<>();
        for (Scene scene : scenes) {
            byId.putIfAbsent(scene.getId(), scene);
        }
        return byId;
    }
}
