package com.story.analysis.consistency;

import java.util.Objects;

/**
 * A consistency problem found in a scenario.
 *
 * @param type        issue kind
 * @param severity    issue severity
 * @param sceneId     scene where the issue was detected, may be {@code null}
 * @param entityName  entity involved, may be {@code null}
 * @param description human-readable description
 */
public record ConsistencyIssue(
        IssueType type,
        IssueSeverity severity,
        String sceneId,
        String entityName,
        String description
) {
    public ConsistencyIssue {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(severity, "severity is required");
        description = description != null ? description : "";
    }

    public boolean isBlocking() {
        return severity.isAtLeast(IssueSeverity.ERROR);
    }
}
