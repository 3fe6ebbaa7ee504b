package com.vidnyan.guard.adapter.in.web;

/**
 * Body of every 400 response that is not a validation result.
 */
public record ErrorResponse(String error) {}
