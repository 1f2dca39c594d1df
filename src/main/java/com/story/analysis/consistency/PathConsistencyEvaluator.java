package com.story.analysis.consistency;

import java.util.concurrent.CompletableFuture;

/**
 * Judges whether a playthrough reads as a consistent story.
 * Implementations typically delegate to a language model; the analyses only select
 * which paths to send and aggregate the verdicts.
 */
public interface PathConsistencyEvaluator {

    /**
     * Evaluates one playthrough.
     *
     * @param request the path and its text
     * @return the verdict for the path
     */
    PathEvaluationResult evaluate(PathEvaluationRequest request);

    /**
     * Evaluates one playthrough asynchronously.
     */
    default CompletableFuture<PathEvaluationResult> evaluateAsync(PathEvaluationRequest request) {
        return CompletableFuture.supplyAsync(() -> evaluate(request));
    }

    /**
     * Returns the name/identifier of this evaluator.
     */
    String getProviderName();

    /**
     * Checks if the evaluator is available and configured. No path is sent to an
     * unavailable evaluator.
     */
    boolean isAvailable();
}
