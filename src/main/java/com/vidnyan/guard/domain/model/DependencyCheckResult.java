package com.vidnyan.guard.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of checking one hypothetical import.
 */
public record DependencyCheckResult(
    boolean success,
    @JsonProperty("isAllowed") boolean isAllowed,
    String message
) implements ToolOutcome {

    public static DependencyCheckResult decided(boolean allowed, String message) {
        return new DependencyCheckResult(true, allowed, message);
    }

    public static DependencyCheckResult failed(String message) {
        return new DependencyCheckResult(false, false, message);
    }
}
