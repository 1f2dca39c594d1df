package com.story.analysis.scenario;

/**
 * Authoring-layer classification of a scene.
 */
public enum SceneType {
    /** Narrative scene. */
    STANDARD,
    /** Opening scene. */
    INTRO,
    /** Decision point with player choices. */
    CHOICE,
    /** Dice roll or other randomised outcome. */
    ROLL,
    /** Endings and other special scenes. */
    SPECIAL
}
