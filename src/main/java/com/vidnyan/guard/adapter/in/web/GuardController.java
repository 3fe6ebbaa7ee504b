package com.vidnyan.guard.adapter.in.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.vidnyan.guard.adapter.in.tool.ProtocolException;
import com.vidnyan.guard.adapter.in.tool.ToolArguments;
import com.vidnyan.guard.adapter.in.tool.ToolDispatcher;
import com.vidnyan.guard.adapter.in.tool.ToolRegistry;
import com.vidnyan.guard.adapter.in.tool.ToolResponseContent;
import com.vidnyan.guard.application.port.in.CheckDependencyUseCase;
import com.vidnyan.guard.application.port.in.ValidateProjectUseCase;
import com.vidnyan.guard.application.port.in.ValidateProjectUseCase.ValidationRequest;
import com.vidnyan.guard.domain.model.DependencyCheckResult;
import com.vidnyan.guard.domain.model.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * HTTP binding. {@code /validate} and {@code /check-dependency} call the use
 * cases directly; {@code /mcp} goes through the shared {@link ToolDispatcher}.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class GuardController {
    
    private final ValidateProjectUseCase validateProject;
    private final CheckDependencyUseCase checkDependency;
    private final ToolDispatcher dispatcher;
    private final ToolRegistry registry;
    private final ToolArguments arguments;
    
    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }
    
    @GetMapping("/tools")
    public List<ToolInfo> tools() {
        return registry.all().stream()
                .map(tool -> new ToolInfo(tool.name(), tool.description(), tool.paramSchema(),
                        registry.isEnabled(tool.kind())))
                .toList();
    }
    
    @PostMapping("/validate")
    public ResponseEntity<ValidationResult> validate(@RequestBody(required = false) JsonNode body) {
        ValidationRequest request = new ValidationRequest(
                arguments.projectRoot(body), arguments.options(body == null ? null : body.get("options")));
        log.info("POST /validate {}", request.root());
        ValidationResult result = validateProject.validate(request);
        return ResponseEntity.status(result.success() ? HttpStatus.OK : HttpStatus.BAD_REQUEST).body(result);
    }
    
    @PostMapping("/check-dependency")
    public ResponseEntity<?> checkDependency(@RequestBody(required = false) JsonNode body) {
        String source = ToolArguments.text(body, "source");
        String target = ToolArguments.text(body, "target");
        if (source == null || source.isBlank() || target == null || target.isBlank()) {
            return ResponseEntity.badRequest().body(new ErrorResponse("Missing source or target dependency"));
        }
        DependencyCheckResult result = checkDependency.checkDependency(
                source, target, arguments.options(body.get("options")));
        return ResponseEntity.ok(result);
    }
    
    @PostMapping("/mcp")
    public McpToolResponse mcp(@RequestBody(required = false) McpToolCall call) {
        if (call == null) {
            throw new IllegalArgumentException("Missing request body");
        }
        log.info("POST /mcp {} ({})", call.name(), call.toolCallId());
        ToolResponseContent content = dispatcher.dispatch(call.name(), call.arguments());
        return new McpToolResponse(call.name(), call.toolCallId(), content);
    }
    
    @ExceptionHandler(ProtocolException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleProtocol(ProtocolException e) {
        log.warn("Rejected tool request at {}: {}", e.failedAt(), e.getMessage());
        return new ErrorResponse(e.getMessage());
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleUnreadable(HttpMessageNotReadableException e) {
        return new ErrorResponse("Malformed JSON body");
    }
    
    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleBadArgument(IllegalArgumentException e) {
        return new ErrorResponse(e.getMessage());
    }
}
