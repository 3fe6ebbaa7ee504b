package com.vidnyan.guard.domain.model;

/**
 * Anything a tool handler may return. Callers can always rely on {@link #success()}.
 */
public interface ToolOutcome {

    boolean success();
}
