package com.story.analysis.consistency;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of evaluating one playthrough.
 *
 * @param path       the evaluated path
 * @param consistent whether the playthrough reads as consistent
 * @param score      consistency score between 0.0 and 1.0
 * @param issues     problems found along the path
 * @param reasoning  free-text explanation from the evaluator
 */
public record PathEvaluationResult(
        SelectedPath path,
        boolean consistent,
        double score,
        List<ConsistencyIssue> issues,
        String reasoning
) {
    public PathEvaluationResult {
        Objects.requireNonNull(path, "path is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0, got " + score);
        }
        issues = issues != null ? List.copyOf(issues) : List.of();
        reasoning = reasoning != null ? reasoning : "";
    }

    public static PathEvaluationResult consistent(SelectedPath path, double score, String reasoning) {
        return new PathEvaluationResult(path, true, score, List.of(), reasoning);
    }

    public static PathEvaluationResult inconsistent(SelectedPath path, double score,
                                                    List<ConsistencyIssue> issues, String reasoning) {
        return new PathEvaluationResult(path, false, score, issues, reasoning);
    }
}
