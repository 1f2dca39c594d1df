package com.story.analysis.consistency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluator used when no real evaluator is configured. Reports every path consistent.
 */
public class NoOpPathConsistencyEvaluator implements PathConsistencyEvaluator {
    private static final Logger log = LoggerFactory.getLogger(NoOpPathConsistencyEvaluator.class);

    @Override
    public PathEvaluationResult evaluate(PathEvaluationRequest request) {
        log.debug("NoOp evaluator called for scenario '{}' path {}",
                request.scenarioId(), request.path().sceneIds());
        return PathEvaluationResult.consistent(request.path(), 1.0,
                "Path evaluation not available - NoOp evaluator in use.");
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
