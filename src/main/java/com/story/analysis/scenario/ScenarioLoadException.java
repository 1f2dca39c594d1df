package com.story.analysis.scenario;

/**
 * Runtime exception thrown when a scenario document cannot be read or is structurally invalid.
 */
public class ScenarioLoadException extends RuntimeException {

    public ScenarioLoadException(String message) {
        super(message);
    }

    public ScenarioLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
