package com.story.analysis.consistency;

import com.story.analysis.graph.DirectedGraph;
import com.story.analysis.graph.Edge;
import com.story.analysis.scenario.Scenario;
import com.story.analysis.scenario.Scene;
import com.story.analysis.scenario.SceneTransition;
import com.story.analysis.scenario.ScenarioGraphBuilder;
import com.story.analysis.statespace.FrontierMergedGraph;
import com.story.analysis.statespace.FrontierMergedGraphBuilder;
import com.story.analysis.statespace.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Explores a scenario's entity state space into a frontier-merged graph.
 *
 * <p>States are {@link EntityState}s merged by {@link EntityState#signature()}. Each scene
 * transition of the scenario graph yields one state transition into the target scene.
 * Links to undeclared scenes are not followed. Ending scenes are terminal, and the
 * depth limit bounds exploration of cyclic scenarios.</p>
 */
public class ScenarioStateSpace {
    private static final Logger log = LoggerFactory.getLogger(ScenarioStateSpace.class);

    private final ScenarioGraphBuilder graphBuilder;

    public ScenarioStateSpace() {
        this(new ScenarioGraphBuilder());
    }

    public ScenarioStateSpace(ScenarioGraphBuilder graphBuilder) {
        this.graphBuilder = Objects.requireNonNull(graphBuilder, "graphBuilder is required");
    }

    /**
     * Explores from the scenario's start scene.
     *
     * @param maxDepth maximum number of transitions from the start scene
     * @return the merged graph, or empty for a scenario without scenes
     */
    public Optional<FrontierMergedGraph<String, EntityState, EntityState.Signature, SceneTransition>> explore(
            Scenario scenario, int maxDepth) {
        Optional<String> start = graphBuilder.findStartScene(scenario);
        if (start.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Scene> scenes = scenario.scenesById();
        DirectedGraph<String, SceneTransition> sceneGraph = graphBuilder.build(scenario);
        Set<String> endings = new HashSet<>(graphBuilder.findEndingScenes(scenario));
        EntityState initialState = EntityState.initial().enter(scenes.get(start.get()));

        FrontierMergedGraph<String, EntityState, EntityState.Signature, SceneTransition> result =
                FrontierMergedGraphBuilder.<String, EntityState, EntityState.Signature, SceneTransition>from(
                                start.get(), initialState)
                        .transitions((sceneId, state) -> {
                            List<StateTransition<String, SceneTransition, EntityState>> next = new ArrayList<>();
                            for (Edge<String, SceneTransition> edge : sceneGraph.outgoingEdges(sceneId)) {
                                Scene target = scenes.get(edge.to());
                                if (target != null) {
                                    next.add(new StateTransition<>(edge.to(), edge.label(), state.enter(target)));
                                }
                            }
                            return next;
                        })
                        .signature(EntityState::signature)
                        .terminalWhen(endings::contains)
                        .maxDepth(maxDepth)
                        .build();

        log.debug("statespace.scenario.explored scenarioId={} stateNodes={} stateEdges={} terminals={}",
                scenario.id(), result.nodeCount(), result.edgeCount(), result.terminalNodes().size());
        return Optional.of(result);
    }
}
