package com.story.analysis.consistency;

/**
 * Kind of consistency issue.
 */
public enum IssueType {
    /** A scene refers to an entity that is not guaranteed to exist on every path reaching it. */
    UNINTRODUCED_ENTITY,
    /** A scene refers to an entity it removes itself. */
    REMOVED_ENTITY_REFERENCED,
    /** A scene links to a scene id the scenario does not declare. */
    UNKNOWN_SCENE_TARGET,
    /** A declared scene cannot be reached from the start scene. */
    UNREACHABLE_SCENE,
    /** Reported by an external path evaluator. */
    NARRATIVE_INCONSISTENCY
}
