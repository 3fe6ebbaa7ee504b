package com.vidnyan.guard.adapter.in.stdio;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guard.adapter.in.tool.MalformedRequestException;
import com.vidnyan.guard.adapter.in.tool.ProtocolException;
import com.vidnyan.guard.adapter.in.tool.RequestState;
import com.vidnyan.guard.adapter.in.tool.ToolDispatcher;
import com.vidnyan.guard.adapter.in.tool.ToolResponseContent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;

/**
 * Line-delimited JSON binding: one request object per input line, one
 * response object per output line, strictly in order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StdioTransport {
    
    private static final String REQUEST_TYPE = "request";
    
    private final ObjectMapper objectMapper;
    private final ToolDispatcher dispatcher;
    
    /**
     * Serve until {@code in} reaches end of stream. Blank lines are skipped.
     */
    public void serve(BufferedReader in, Writer out) throws IOException {
        String line;
        int handled = 0;
        while ((line = in.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            out.write(handleLine(line));
            out.write('\n');
            out.flush();
            handled++;
        }
        log.info("Input closed after {} requests", handled);
    }
    
    /**
     * Handle one request line. Never throws; every line gets exactly one response.
     */
    public String handleLine(String line) {
        String id = null;
        String name = null;
        StdioResponse response;
        try {
            JsonNode request = parse(line);
            id = text(request, "id");
            name = text(request, "name");
            if (id == null || id.isBlank()) {
                throw new MalformedRequestException("Missing request id");
            }
            String type = text(request, "type");
            if (type != null && !REQUEST_TYPE.equals(type)) {
                throw new MalformedRequestException("Unsupported message type: " + type);
            }
            ToolResponseContent content = dispatcher.dispatch(name, request.get("params"));
            response = StdioResponse.of(id, name, content);
        } catch (ProtocolException e) {
            log.warn("Rejected request {} at {}: {}", id, e.failedAt(), e.getMessage());
            response = StdioResponse.error(id, name, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure handling request {}", id, e);
            response = StdioResponse.error(id, name, "Internal error: " + e.getMessage());
        }
        return write(response);
    }
    
    private JsonNode parse(String line) {
        JsonNode request;
        try {
            request = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new MalformedRequestException("Malformed JSON: " + e.getOriginalMessage(),
                    RequestState.RECEIVED);
        }
        if (request == null || !request.isObject()) {
            throw new MalformedRequestException("Request must be a JSON object",
                    RequestState.RECEIVED);
        }
        return request;
    }
    
    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || !value.isValueNode() ? null : value.asText();
    }
    
    private String write(StdioResponse response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize response {}", response.requestId(), e);
            return "{\"type\":\"response\",\"content\":{\"type\":\"error\",\"message\":\"Failed to serialize response\"}}";
        }
    }
}
