package com.vidnyan.guard.adapter.in.tool;

import com.vidnyan.guard.domain.model.ToolOutcome;

/**
 * {@code content} of a tool response.
 */
public record ToolResponseContent(boolean success, ToolOutcome results) {
    
    public static ToolResponseContent of(ToolOutcome outcome) {
        return new ToolResponseContent(outcome.success(), outcome);
    }
}
