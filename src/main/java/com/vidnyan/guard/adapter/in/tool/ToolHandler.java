package com.vidnyan.guard.adapter.in.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.vidnyan.guard.domain.model.ToolOutcome;

/**
 * Executes one tool. {@code arguments} is always a JSON object.
 */
@FunctionalInterface
public interface ToolHandler {
    
    ToolOutcome handle(JsonNode arguments);
}
