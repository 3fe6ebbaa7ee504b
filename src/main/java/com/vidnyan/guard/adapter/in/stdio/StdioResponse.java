package com.vidnyan.guard.adapter.in.stdio;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One output line. {@code id} and {@code request_id} both echo the request id,
 * and are left out when it could not be read.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StdioResponse(
    String id,
    String type,
    @JsonProperty("request_id") String requestId,
    String name,
    Object content
) {
    static final String TYPE = "response";
    
    static StdioResponse of(String requestId, String name, Object content) {
        return new StdioResponse(requestId, TYPE, requestId, name, content);
    }
    
    static StdioResponse error(String requestId, String name, String message) {
        return of(requestId, name, new ErrorContent("error", message));
    }
    
    record ErrorContent(String type, String message) {}
}
