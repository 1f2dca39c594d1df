package com.story.analysis.scenario;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Reads scenarios from JSON.
 *
 * <p>Expected format:</p>
 * <pre>
 * {
 *   "id": "forest-quest",
 *   "title": "The Forest Quest",
 *   "scenes": [
 *     {"id": "intro", "type": "intro", "next_scene_id": "crossroads",
 *      "introduced_entities": ["hero"]},
 *     {"id": "crossroads", "type": "choice", "branches": [
 *        {"choice": "Go left", "next_scene_id": "cave"},
 *        {"choice": "Go right", "next_scene_id": "river"}]},
 *     ...
 *   ]
 * }
 * </pre>
 *
 * <p>Unknown properties are ignored and enum values are case-insensitive. Read and parse
 * failures, as well as blank or duplicate scene ids, raise {@link ScenarioLoadException}.</p>
 */
public class ScenarioLoader {
    private static final Logger log = LoggerFactory.getLogger(ScenarioLoader.class);

    private final ObjectMapper objectMapper;

    public ScenarioLoader() {
        this(JsonMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build());
    }

    public ScenarioLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Scenario fromJson(String json) {
        try {
            return validate(objectMapper.readValue(json, Scenario.class));
        } catch (JsonProcessingException e) {
            throw new ScenarioLoadException("Invalid scenario JSON: " + e.getOriginalMessage(), e);
        }
    }

    public Scenario load(InputStream input) {
        try {
            return validate(objectMapper.readValue(input, Scenario.class));
        } catch (IOException e) {
            throw new ScenarioLoadException("Failed to read scenario: " + e.getMessage(), e);
        }
    }

    public Scenario load(Reader reader) {
        try {
            return validate(objectMapper.readValue(reader, Scenario.class));
        } catch (IOException e) {
            throw new ScenarioLoadException("Failed to read scenario: " + e.getMessage(), e);
        }
    }

    public Scenario load(Path path) {
        try (InputStream input = Files.newInputStream(path)) {
            return load(input);
        } catch (IOException e) {
            throw new ScenarioLoadException("Failed to open scenario file " + path, e);
        }
    }

    private Scenario validate(Scenario scenario) {
        if (scenario == null) {
            throw new ScenarioLoadException("Scenario document is empty");
        }
        Set<String> seen = new HashSet<>();
        for (Scene scene : scenario.scenes()) {
            if (scene.getId().isBlank()) {
                throw new ScenarioLoadException("Scenario '" + scenario.id() + "' contains a scene with a blank id");
            }
            if (!seen.add(scene.getId())) {
                throw new ScenarioLoadException(
                        "Scenario '" + scenario.id() + "' declares scene '" + scene.getId() + "' more than once");
            }
        }
        log.info("scenario.loaded scenarioId={} scenes={}", scenario.id(), scenario.scenes().size());
        return scenario;
    }
}
