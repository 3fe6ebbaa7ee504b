package com.vidnyan.guard.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code POST /mcp} request body.
 */
public record McpToolCall(
    String name,
    @JsonProperty("tool_call_id") String toolCallId,
    JsonNode arguments
) {}
