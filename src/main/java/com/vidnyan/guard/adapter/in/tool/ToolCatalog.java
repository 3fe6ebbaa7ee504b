package com.vidnyan.guard.adapter.in.tool;

import com.vidnyan.guard.application.port.in.CheckDependencyUseCase;
import com.vidnyan.guard.application.port.in.ValidateProjectUseCase;
import com.vidnyan.guard.application.port.in.ValidateProjectUseCase.ValidationRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handler table: one definition per {@link ToolKind}, wired to the use cases.
 */
@Component
@RequiredArgsConstructor
public class ToolCatalog {
    
    private final ValidateProjectUseCase validateProject;
    private final CheckDependencyUseCase checkDependency;
    private final ToolArguments arguments;
    
    public List<ToolDefinition> definitions() {
        return List.of(
                define(ToolKind.ARCHITECTURE_CHECK,
                        properties("path", "string", "options", "object"),
                        args -> validateProject.validate(new ValidationRequest(
                                arguments.projectRoot(args), arguments.options(args.get("options"))))),
                define(ToolKind.VALIDATE_FILE,
                        properties("filePath", "string", "content", "string", "options", "object"),
                        args -> validateProject.validateContent(
                                ToolArguments.text(args, "filePath"),
                                ToolArguments.text(args, "content"),
                                arguments.options(args.get("options")))),
                define(ToolKind.DEPENDENCY_CHECK,
                        properties("path", "string", "options", "object"),
                        args -> checkDependency.validateDependencies(
                                arguments.projectRoot(args), arguments.options(args.get("options")))),
                define(ToolKind.CHECK_IMPORT_ALLOWED,
                        properties("source", "string", "target", "string", "options", "object"),
                        args -> checkDependency.checkDependency(
                                ToolArguments.text(args, "source"),
                                ToolArguments.text(args, "target"),
                                arguments.options(args.get("options"))))
        );
    }
    
    private static ToolDefinition define(ToolKind kind, Map<String, Object> properties, ToolHandler handler) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", kind.requiredParams());
        return new ToolDefinition(kind, kind.description(), schema, kind.requiredParams(), handler);
    }
    
    /**
     * Alternating name/type pairs to a JSON-schema properties map.
     */
    private static Map<String, Object> properties(String... nameTypePairs) {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (int i = 0; i + 1 < nameTypePairs.length; i += 2) {
            properties.put(nameTypePairs[i], Map.of("type", nameTypePairs[i + 1]));
        }
        return properties;
    }
}
