package com.story.analysis.scenario;

/**
 * How one scene leads to another.
 */
public enum TransitionType {
    /** The scene's linear next-scene link. */
    LINEAR,
    /** A player choice. */
    BRANCH
}
