package com.story.analysis.consistency;

/**
 * How a scenario consistency evaluation ended.
 */
public enum EvaluationStatus {
    /** Every selected path was sent to the evaluator and a verdict came back. */
    COMPLETED,
    /** The evaluator failed; no verdict is available. */
    FAILED,
    /** The evaluator was not available, so no path was sent. */
    SKIPPED
}
