package com.vidnyan.guard.adapter.in.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.vidnyan.guard.domain.model.ToolOutcome;
import com.vidnyan.guard.domain.model.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Single dispatch path shared by the HTTP and stdio transports.
 * <p>
 * Protocol problems (no name, bad arguments, unknown tool) are thrown as
 * {@link ProtocolException}. Anything the handler throws is turned into a
 * failed {@link ValidationResult}: the tool ran, it just failed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolDispatcher {
    
    private final ToolRegistry registry;
    
    public ToolResponseContent dispatch(String name, JsonNode arguments) {
        // RECEIVED -> PARSED
        if (name == null || name.isBlank()) {
            throw new MalformedRequestException("Missing tool name", RequestState.RECEIVED);
        }
        JsonNode args = arguments == null || arguments.isNull() || arguments.isMissingNode()
                ? JsonNodeFactory.instance.objectNode()
                : arguments;
        if (!args.isObject()) {
            throw new MalformedRequestException("Tool arguments must be a JSON object", RequestState.RECEIVED);
        }
        
        // PARSED -> DISPATCHED
        ToolDefinition tool = registry.find(name).orElseThrow(() -> new UnknownToolException(name));
        List<String> missing = tool.requiredParams().stream()
                .filter(param -> !args.hasNonNull(param))
                .toList();
        if (!missing.isEmpty()) {
            throw new MalformedRequestException("Missing required parameters for " + name + ": "
                    + String.join(", ", missing));
        }
        
        // DISPATCHED -> EXECUTING -> RESPONDED
        log.debug("Dispatching tool {}", name);
        ToolOutcome outcome;
        try {
            outcome = tool.handler().handle(args);
        } catch (Exception e) {
            log.error("Tool {} failed: {}", name, e.getMessage(), e);
            outcome = ValidationResult.failure("Tool '" + name + "' failed: " + e.getMessage(),
                    "Tool '" + name + "' failed");
        }
        return ToolResponseContent.of(outcome);
    }
}
