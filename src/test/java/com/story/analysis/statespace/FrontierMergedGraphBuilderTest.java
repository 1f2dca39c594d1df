package com.story.analysis.statespace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FrontierMergedGraphBuilder Tests")
class FrontierMergedGraphBuilderTest {

    private static StateTransition<String, String, Integer> step(String to, String label, int state) {
        return new StateTransition<>(to, label, state);
    }

    @Nested
    @DisplayName("Merging")
    class Merging {

        @Test
        @DisplayName("States with the same scene and signature share one node")
        void mergesBySignature() {
            // A counter that grows forever, abstracted to its parity
            FrontierMergedGraph<String, Integer, Integer, String> result = FrontierMergedGraphBuilder
                    .<String, Integer, Integer, String>from("loop", 0)
                    .transitions((scene, state) -> List.of(step("loop", "inc", state + 1)))
                    .signature(state -> state % 2)
                    .build();

            assertEquals(2, result.nodeCount());
            assertEquals(2, result.edgeCount());
            assertTrue(result.terminalNodes().isEmpty());
        }

        @Test
        @DisplayName("Every transition contributes an edge, even into a known node")
        void edgesIntoKnownNodes() {
            Map<String, List<String>> links = Map.of(
                    "A", List.of("B", "C"),
                    "B", List.of("D"),
                    "C", List.of("D"),
                    "D", List.of());

            FrontierMergedGraph<String, Integer, Integer, String> result = FrontierMergedGraphBuilder
                    .<String, Integer, Integer, String>from("A", 0)
                    .transitions((scene, state) -> links.get(scene).stream()
                            .map(to -> step(to, scene + ">" + to, state + 1))
                            .toList())
                    .signature(state -> 0)
                    .build();

            assertEquals(4, result.nodeCount());
            assertEquals(4, result.edgeCount());
            StateNode<String, Integer> d = new StateNode<>("D", 0);
            assertEquals(2, result.graph().inDegree(d));
            assertTrue(result.isTerminal(d));
        }

        @Test
        @DisplayName("First state to reach a node is its representative")
        void representativeIsFirstArrival() {
            // A reaches B directly with 1, and through C with 2
            Map<String, List<String>> links = Map.of(
                    "A", List.of("B", "C"),
                    "C", List.of("B"),
                    "B", List.of());

            FrontierMergedGraph<String, Integer, String, String> result = FrontierMergedGraphBuilder
                    .<String, Integer, String, String>from("A", 0)
                    .transitions((scene, state) -> links.get(scene).stream()
                            .map(to -> step(to, to, state + 1))
                            .toList())
                    .signature(state -> "any")
                    .build();

            assertEquals(Optional.of(1), result.representativeState(new StateNode<>("B", "any")));
            assertEquals(Optional.of(0), result.representativeState(result.initialNode()));
        }

        @Test
        @DisplayName("Node count never exceeds distinct scene and signature pairs")
        void cardinalityBound() {
            // Two scenes alternating, state counts steps, signature keeps state mod 3
            FrontierMergedGraph<String, Integer, Integer, String> result = FrontierMergedGraphBuilder
                    .<String, Integer, Integer, String>from("ping", 0)
                    .transitions((scene, state) -> List.of(
                            step(scene.equals("ping") ? "pong" : "ping", "swap", state + 1),
                            step(scene, "stay", state + 2)))
                    .signature(state -> state % 3)
                    .maxDepth(20)
                    .build();

            Set<String> pairs = new HashSet<>();
            for (StateNode<String, Integer> node : result.graph().nodes()) {
                pairs.add(node.sceneId() + "#" + node.signature());
            }
            assertEquals(pairs.size(), result.nodeCount());
            assertTrue(result.nodeCount() <= 2 * 3);
        }
    }

    @Nested
    @DisplayName("Termination")
    class Termination {

        @Test
        @DisplayName("Depth limit marks the frontier as terminal")
        void depthLimit() {
            FrontierMergedGraph<String, Integer, Integer, String> result = FrontierMergedGraphBuilder
                    .<String, Integer, Integer, String>from("s0", 0)
                    .transitions((scene, state) -> List.of(step("s" + (state + 1), "next", state + 1)))
                    .signature(state -> state)
                    .maxDepth(3)
                    .build();

            assertEquals(4, result.nodeCount());
            assertEquals(Set.of(new StateNode<>("s3", 3)), result.terminalNodes());
        }

        @Test
        @DisplayName("Terminal scenes are not expanded")
        void terminalPredicate() {
            FrontierMergedGraph<String, Integer, Integer, String> result = FrontierMergedGraphBuilder
                    .<String, Integer, Integer, String>from("start", 0)
                    .transitions((scene, state) -> List.of(step(scene.equals("start") ? "end" : "beyond", "next", state)))
                    .signature(state -> state)
                    .terminalWhen("end"::equals)
                    .build();

            assertEquals(2, result.nodeCount());
            assertTrue(result.isTerminal(new StateNode<>("end", 0)));
            assertFalse(result.graph().containsNode(new StateNode<>("beyond", 0)));
        }

        @Test
        @DisplayName("No transitions means terminal, whether empty or null")
        void noTransitions() {
            FrontierMergedGraph<String, Integer, Integer, String> result = FrontierMergedGraphBuilder
                    .<String, Integer, Integer, String>from("only", 0)
                    .transitions((scene, state) -> null)
                    .signature(state -> state)
                    .build();

            assertEquals(1, result.nodeCount());
            assertTrue(result.isTerminal(result.initialNode()));
        }

        @Test
        @DisplayName("Depth zero stops at the initial node")
        void depthZero() {
            FrontierMergedGraph<String, Integer, Integer, String> result = FrontierMergedGraphBuilder
                    .<String, Integer, Integer, String>from("s0", 0)
                    .transitions((scene, state) -> List.of(step("s1", "next", 1)))
                    .signature(state -> state)
                    .maxDepth(0)
                    .build();

            assertEquals(1, result.nodeCount());
            assertTrue(result.isTerminal(result.initialNode()));
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("Negative depth is rejected")
        void negativeDepth() {
            assertThrows(IllegalArgumentException.class,
                    () -> FrontierMergedGraphBuilder.<String, Integer, Integer, String>from("s", 0).maxDepth(-1));
        }

        @Test
        @DisplayName("Transition and signature functions are required")
        void requiredFunctions() {
            assertThrows(NullPointerException.class,
                    () -> FrontierMergedGraphBuilder.<String, Integer, Integer, String>from("s", 0)
                            .signature(state -> state)
                            .build());
            assertThrows(NullPointerException.class,
                    () -> FrontierMergedGraphBuilder.<String, Integer, Integer, String>from("s", 0)
                            .transitions((scene, state) -> null)
                            .build());
        }
    }
}
