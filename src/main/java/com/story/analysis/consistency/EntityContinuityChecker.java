package com.story.analysis.consistency;

import com.story.analysis.dataflow.DataFlowAnalysis;
import com.story.analysis.graph.DirectedGraph;
import com.story.analysis.graph.GraphSearch;
import com.story.analysis.scenario.Scenario;
import com.story.analysis.scenario.Scene;
import com.story.analysis.scenario.SceneTransition;
import com.story.analysis.scenario.ScenarioGraphBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Flags dangling entity references using the must-introduced analysis.
 *
 * <p>For every scene reachable from the start scene, each referenced entity must be in the
 * scene's must-introduced set or introduced by the scene itself. Local introductions are
 * always accepted because the analysis leaves scenes it never schedules at the empty set.
 * Structural problems (links to undeclared scenes, unreachable scenes) are reported too.</p>
 */
public class EntityContinuityChecker {
    private static final Logger log = LoggerFactory.getLogger(EntityContinuityChecker.class);

    private final ScenarioGraphBuilder graphBuilder;

    public EntityContinuityChecker() {
        this(new ScenarioGraphBuilder());
    }

    public EntityContinuityChecker(ScenarioGraphBuilder graphBuilder) {
        this.graphBuilder = Objects.requireNonNull(graphBuilder, "graphBuilder is required");
    }

    /**
     * Runs the must-introduced analysis from the computed start scene and checks every scene.
     * A scenario without scenes has no issues.
     */
    public List<ConsistencyIssue> check(Scenario scenario) {
        Optional<String> start = graphBuilder.findStartScene(scenario);
        if (start.isEmpty()) {
            return List.of();
        }
        Map<String, Set<String>> must = DataFlowAnalysis.computeMustIntroducedSets(
                graphBuilder.toDataFlowNodes(scenario), start.get());
        return check(scenario, start.get(), must);
    }

    /**
     * Checks every scene against precomputed must-introduced sets.
     *
     * @param scenario       the scenario
     * @param startSceneId   the scene the analysis started from
     * @param mustIntroduced must-introduced set per scene id
     * @return issues in scene declaration order
     */
    public List<ConsistencyIssue> check(Scenario scenario, String startSceneId, Map<String, Set<String>> mustIntroduced) {
        Map<String, Scene> scenes = scenario.scenesById();
        DirectedGraph<String, SceneTransition> graph = graphBuilder.build(scenario);
        Set<String> reachable = GraphSearch.reachableFrom(graph, startSceneId);
        List<ConsistencyIssue> issues = new ArrayList<>();

        for (Scene scene : scenes.values()) {
            for (String target : scene.targetSceneIds()) {
                if (!scenes.containsKey(target)) {
                    issues.add(new ConsistencyIssue(IssueType.UNKNOWN_SCENE_TARGET, IssueSeverity.ERROR,
                            scene.getId(), null,
                            "Scene '" + scene.getId() + "' leads to undeclared scene '" + target + "'"));
                }
            }

            if (!reachable.contains(scene.getId())) {
                issues.add(new ConsistencyIssue(IssueType.UNREACHABLE_SCENE, IssueSeverity.WARNING,
                        scene.getId(), null,
                        "Scene '" + scene.getId() + "' is not reachable from start scene '" + startSceneId + "'"));
                continue;
            }

            Set<String> guaranteed = mustIntroduced.getOrDefault(scene.getId(), Set.of());
            for (String entity : new TreeSet<>(scene.getReferencedEntities())) {
                if (guaranteed.contains(entity)) {
                    continue;
                }
                if (scene.getRemovedEntities().contains(entity)) {
                    issues.add(new ConsistencyIssue(IssueType.REMOVED_ENTITY_REFERENCED, IssueSeverity.WARNING,
                            scene.getId(), entity,
                            "Entity '" + entity + "' is referenced in scene '" + scene.getId()
                                    + "' which also removes it"));
                } else if (!scene.getIntroducedEntities().contains(entity)) {
                    issues.add(new ConsistencyIssue(IssueType.UNINTRODUCED_ENTITY, IssueSeverity.ERROR,
                            scene.getId(), entity,
                            "Entity '" + entity + "' is referenced in scene '" + scene.getId()
                                    + "' but is not introduced on every path from '" + startSceneId + "'"));
                }
            }
        }

        log.debug("continuity.checked scenarioId={} scenes={} issues={}",
                scenario.id(), scenes.size(), issues.size());
        return Collections.unmodifiableList(issues);
    }
}
