package com.story.analysis.consistency;

import com.story.analysis.scenario.Scenario;
import com.story.analysis.scenario.SceneTransition;
import com.story.analysis.scenario.ScenarioLoader;
import com.story.analysis.scenario.Scene;
import com.story.analysis.statespace.FrontierMergedGraph;
import com.story.analysis.statespace.StateNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScenarioStateSpace Tests")
class ScenarioStateSpaceTest {

    private ScenarioStateSpace stateSpace;

    @BeforeEach
    void setUp() {
        stateSpace = new ScenarioStateSpace();
    }

    private static Scenario forestQuest() throws Exception {
        try (InputStream in = ScenarioStateSpaceTest.class.getResourceAsStream("/scenarios/forest-quest.json")) {
            return new ScenarioLoader().load(in);
        }
    }

    @Test
    @DisplayName("Scenes reached with different entities become different state nodes")
    void branchesKeepDistinctStates() throws Exception {
        FrontierMergedGraph<String, EntityState, EntityState.Signature, SceneTransition> graph =
                stateSpace.explore(forestQuest(), 50).orElseThrow();

        // clearing and finale are each reached with a lantern or with a boat
        assertEquals(8, graph.nodeCount());
        assertEquals(7, graph.edgeCount());
        assertEquals(2, graph.terminalNodes().size());
        for (StateNode<String, EntityState.Signature> terminal : graph.terminalNodes()) {
            assertEquals("finale", terminal.sceneId());
        }
    }

    @Test
    @DisplayName("Initial state has entered the start scene")
    void initialState() throws Exception {
        FrontierMergedGraph<String, EntityState, EntityState.Signature, SceneTransition> graph =
                stateSpace.explore(forestQuest(), 50).orElseThrow();

        assertEquals("intro", graph.initialNode().sceneId());
        EntityState initial = graph.representativeState(graph.initialNode()).orElseThrow();
        assertEquals(Set.of("mira"), initial.getPresentEntities());
        assertEquals(1, initial.getScenesVisited());
    }

    @Test
    @DisplayName("Branches that change nothing merge again")
    void neutralBranchesMerge() {
        Scenario scenario = Scenario.of("merge",
                Scene.builder("a").introduces("hero").branch("Left", "b").branch("Right", "c").build(),
                Scene.builder("b").nextSceneId("d").build(),
                Scene.builder("c").nextSceneId("d").build(),
                Scene.builder("d").build());

        FrontierMergedGraph<String, EntityState, EntityState.Signature, SceneTransition> graph =
                stateSpace.explore(scenario, 50).orElseThrow();

        assertEquals(4, graph.nodeCount());
        assertEquals(4, graph.edgeCount());
    }

    @Test
    @DisplayName("Loops terminate through state merging")
    void loopsTerminate() {
        Scenario scenario = Scenario.of("loop",
                Scene.builder("camp").introduces("fire").nextSceneId("woods").build(),
                Scene.builder("woods").branch("Back to camp", "camp").branch("Leave", "road").build(),
                Scene.builder("road").build());

        FrontierMergedGraph<String, EntityState, EntityState.Signature, SceneTransition> graph =
                stateSpace.explore(scenario, 1_000).orElseThrow();

        assertEquals(3, graph.nodeCount());
        assertTrue(graph.isTerminal(new StateNode<>("road", new EntityState.Signature(Set.of("fire"), Set.of()))));
    }

    @Test
    @DisplayName("Depth limit bounds exploration")
    void depthLimit() throws Exception {
        FrontierMergedGraph<String, EntityState, EntityState.Signature, SceneTransition> graph =
                stateSpace.explore(forestQuest(), 1).orElseThrow();

        assertEquals(2, graph.nodeCount());
        assertTrue(graph.terminalNodes().stream().allMatch(n -> n.sceneId().equals("crossroads")));
    }

    @Test
    @DisplayName("Links to undeclared scenes are not followed")
    void undeclaredTargets() {
        Scenario scenario = Scenario.of("dangling",
                Scene.builder("a").branch("Go", "missing").branch("Stay", "b").build(),
                Scene.builder("b").build());

        FrontierMergedGraph<String, EntityState, EntityState.Signature, SceneTransition> graph =
                stateSpace.explore(scenario, 10).orElseThrow();

        assertEquals(2, graph.nodeCount());
        assertTrue(graph.graph().nodes().stream().noneMatch(n -> n.sceneId().equals("missing")));
    }

    @Test
    @DisplayName("Scenario without scenes has no state space")
    void emptyScenario() {
        assertEquals(Optional.empty(), stateSpace.explore(Scenario.of("empty"), 10));
    }
}
