package com.story.analysis.consistency;

import com.story.analysis.scenario.Scenario;
import com.story.analysis.scenario.Scene;
import com.story.analysis.scenario.SceneTransition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Path evaluation Tests")
class PathEvaluationTest {

    private static final Scenario SCENARIO = Scenario.of("s",
            Scene.builder("a").content("Once upon a time.").branch("Open the door", "b").build(),
            Scene.builder("b").content("The door creaks.").nextSceneId("c").build(),
            Scene.builder("c").content("The end.").build());

    private static final SelectedPath PATH = new SelectedPath(List.of("a", "b", "c"), List.of(
            SceneTransition.branch("a", "b", "Open the door"),
            SceneTransition.linear("b", "c")));

    @Nested
    @DisplayName("PathEvaluationRequest")
    class Request {

        @Test
        @DisplayName("Playthrough text joins scene contents and shows choices")
        void playthroughText() {
            PathEvaluationRequest request = PathEvaluationRequest.of(SCENARIO, PATH);

            assertEquals("s", request.scenarioId());
            assertEquals("Once upon a time.\n\n> Open the door\n\nThe door creaks.\n\nThe end.", request.content());
        }
    }

    @Nested
    @DisplayName("PathEvaluationResult")
    class Result {

        @Test
        @DisplayName("Score must lie between 0 and 1")
        void scoreRange() {
            assertThrows(IllegalArgumentException.class,
                    () -> PathEvaluationResult.consistent(PATH, 1.5, "too good"));
            assertThrows(IllegalArgumentException.class,
                    () -> PathEvaluationResult.inconsistent(PATH, -0.1, List.of(), "too bad"));
        }

        @Test
        @DisplayName("Factories set the verdict")
        void factories() {
            ConsistencyIssue issue = new ConsistencyIssue(IssueType.NARRATIVE_INCONSISTENCY, IssueSeverity.ERROR,
                    "b", null, "The door was never mentioned");

            PathEvaluationResult bad = PathEvaluationResult.inconsistent(PATH, 0.2, List.of(issue), "door");
            assertFalse(bad.consistent());
            assertEquals(List.of(issue), bad.issues());

            PathEvaluationResult good = PathEvaluationResult.consistent(PATH, 0.9, null);
            assertTrue(good.consistent());
            assertEquals("", good.reasoning());
        }
    }

    @Nested
    @DisplayName("ScenarioConsistencyReport")
    class Report {

        @Test
        @DisplayName("Overall score is the average and one bad path makes the report inconsistent")
        void aggregate() {
            ScenarioConsistencyReport report = ScenarioConsistencyReport.aggregate("s", List.of(
                    PathEvaluationResult.consistent(PATH, 1.0, "fine"),
                    PathEvaluationResult.inconsistent(PATH, 0.5, List.of(), "odd")));

            assertTrue(report.isEvaluated());
            assertFalse(report.consistent());
            assertEquals(0.75, report.overallScore(), 1e-9);
            assertEquals(1, report.inconsistentPathCount());
            assertNotNull(report.evaluatedAt());
        }

        @Test
        @DisplayName("No paths means a consistent report with full score")
        void noPaths() {
            ScenarioConsistencyReport report = ScenarioConsistencyReport.aggregate("s", List.of());

            assertTrue(report.consistent());
            assertEquals(1.0, report.overallScore());
        }

        @Test
        @DisplayName("Failed report is inconsistent with zero score")
        void failed() {
            ScenarioConsistencyReport report = ScenarioConsistencyReport.failed("s");

            assertEquals(EvaluationStatus.FAILED, report.status());
            assertFalse(report.consistent());
            assertEquals(0.0, report.overallScore());
            assertTrue(report.pathResults().isEmpty());
        }

        @Test
        @DisplayName("Skipped report claims nothing")
        void skipped() {
            ScenarioConsistencyReport report = ScenarioConsistencyReport.skipped("s");

            assertEquals(EvaluationStatus.SKIPPED, report.status());
            assertFalse(report.isEvaluated());
            assertFalse(report.consistent());
            assertEquals(0.0, report.overallScore());
        }
    }

    @Nested
    @DisplayName("NoOpPathConsistencyEvaluator")
    class NoOp {

        @Test
        @DisplayName("Reports every path consistent and is not available")
        void noOp() {
            NoOpPathConsistencyEvaluator evaluator = new NoOpPathConsistencyEvaluator();

            PathEvaluationResult result = evaluator.evaluateAsync(PathEvaluationRequest.of(SCENARIO, PATH)).join();

            assertTrue(result.consistent());
            assertEquals(1.0, result.score());
            assertEquals(PATH, result.path());
            assertEquals("NoOp", evaluator.getProviderName());
            assertFalse(evaluator.isAvailable());
        }
    }
}
