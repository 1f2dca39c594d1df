package com.story.analysis.consistency;

public enum IssueSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    public boolean isAtLeast(IssueSeverity other) {
        return compareTo(other) >= 0;
    }
}
