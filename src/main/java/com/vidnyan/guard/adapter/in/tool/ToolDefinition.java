package com.vidnyan.guard.adapter.in.tool;

import java.util.List;
import java.util.Map;

/**
 * A registered tool: its kind, the schema callers see, and the handler that runs it.
 */
public record ToolDefinition(
    ToolKind kind,
    String description,
    Map<String, Object> paramSchema,
    List<String> requiredParams,
    ToolHandler handler
) {
    public ToolDefinition {
        paramSchema = Map.copyOf(paramSchema);
        requiredParams = List.copyOf(requiredParams);
    }
    
    public String name() {
        return kind.wireName();
    }
}
