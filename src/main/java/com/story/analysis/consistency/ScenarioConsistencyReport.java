package com.story.analysis.consistency;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated verdict over the selected paths of a scenario.
 *
 * @param scenarioId   the scenario
 * @param status       whether the paths were evaluated
 * @param consistent   true only if every evaluated path is consistent
 * @param overallScore average of the path scores, 1.0 when no path was selected
 * @param pathResults  per-path verdicts in selection order
 * @param evaluatedAt  when the report was produced
 */
public record ScenarioConsistencyReport(
        String scenarioId,
        EvaluationStatus status,
        boolean consistent,
        double overallScore,
        List<PathEvaluationResult> pathResults,
        Instant evaluatedAt
) {
    public ScenarioConsistencyReport {
        Objects.requireNonNull(scenarioId, "scenarioId is required");
        Objects.requireNonNull(status, "status is required");
        pathResults = pathResults != null ? List.copyOf(pathResults) : List.of();
        evaluatedAt = evaluatedAt != null ? evaluatedAt : Instant.now();
    }

    /**
     * Aggregates per-path verdicts.
     */
    public static ScenarioConsistencyReport aggregate(String scenarioId, List<PathEvaluationResult> results) {
        boolean consistent = true;
        double total = 0.0;
        for (PathEvaluationResult result : results) {
            consistent &= result.consistent();
            total += result.score();
        }
        double overall = results.isEmpty() ? 1.0 : total / results.size();
        return new ScenarioConsistencyReport(scenarioId, EvaluationStatus.COMPLETED, consistent, overall, results,
                Instant.now());
    }

    /**
     * Report for an evaluation that could not be completed.
     */
    public static ScenarioConsistencyReport failed(String scenarioId) {
        return new ScenarioConsistencyReport(scenarioId, EvaluationStatus.FAILED, false, 0.0, List.of(), Instant.now());
    }

    /**
     * Report for an evaluation that was not attempted. Nothing was verified, so it is not consistent.
     */
    public static ScenarioConsistencyReport skipped(String scenarioId) {
        return new ScenarioConsistencyReport(scenarioId, EvaluationStatus.SKIPPED, false, 0.0, List.of(), Instant.now());
    }

    public boolean isEvaluated() {
        return status == EvaluationStatus.COMPLETED;
    }

    public long inconsistentPathCount() {
        return pathResults.stream().filter(r -> !r.consistent()).count();
    }
}
