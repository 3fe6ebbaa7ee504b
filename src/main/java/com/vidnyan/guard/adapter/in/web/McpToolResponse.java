package com.vidnyan.guard.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.guard.adapter.in.tool.ToolResponseContent;

/**
 * {@code POST /mcp} response body.
 */
public record McpToolResponse(
    String name,
    @JsonProperty("tool_call_id") String toolCallId,
    ToolResponseContent content
) {}
