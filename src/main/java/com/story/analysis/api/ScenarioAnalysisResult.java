package com.story.analysis.api;

import com.story.analysis.consistency.ConsistencyIssue;
import com.story.analysis.consistency.SelectedPath;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Result of analyzing one scenario.
 *
 * @param scenarioId      the scenario
 * @param startSceneId    the start scene, {@code null} for a scenario without scenes
 * @param endingSceneIds  scenes without successors, in declaration order
 * @param mustIntroduced  must-introduced entity set per scene id
 * @param issues          continuity and structural issues
 * @param stateNodeCount  merged state nodes explored, 0 when exploration is disabled
 * @param stateEdgeCount  merged state edges explored, 0 when exploration is disabled
 * @param selectedPaths   paths selected for evaluation
 */
public record ScenarioAnalysisResult(
        String scenarioId,
        String startSceneId,
        List<String> endingSceneIds,
        Map<String, Set<String>> mustIntroduced,
        List<ConsistencyIssue> issues,
        int stateNodeCount,
        int stateEdgeCount,
        List<SelectedPath> selectedPaths
) {
    public ScenarioAnalysisResult {
        Objects.requireNonNull(scenarioId, "scenarioId is required");
        endingSceneIds = endingSceneIds != null ? List.copyOf(endingSceneIds) : List.of();
        mustIntroduced = mustIntroduced != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(mustIntroduced)) : Map.of();
        issues = issues != null ? List.copyOf(issues) : List.of();
        selectedPaths = selectedPaths != null ? List.copyOf(selectedPaths) : List.of();
    }

    /**
     * Result for a scenario without scenes.
     */
    public static ScenarioAnalysisResult empty(String scenarioId) {
        return new ScenarioAnalysisResult(scenarioId, null, List.of(), Map.of(), List.of(), 0, 0, List.of());
    }

    public Optional<String> start() {
        return Optional.ofNullable(startSceneId);
    }

    /**
     * Must-introduced set of a scene, empty for unknown scenes.
     */
    public Set<String> mustIntroducedAt(String sceneId) {
        return mustIntroduced.getOrDefault(sceneId, Set.of());
    }

    /**
     * Returns true if no blocking issue was found.
     */
    public boolean isConsistent() {
        return issues.stream().noneMatch(ConsistencyIssue::isBlocking);
    }
}
