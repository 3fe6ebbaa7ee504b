package com.vidnyan.guard.adapter.in.web;

import java.util.Map;

/**
 * Entry of the {@code GET /tools} listing.
 */
public record ToolInfo(String name, String description, Map<String, Object> paramSchema, boolean enabled) {}
