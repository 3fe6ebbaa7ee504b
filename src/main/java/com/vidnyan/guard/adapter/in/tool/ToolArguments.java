package com.vidnyan.guard.adapter.in.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.vidnyan.guard.config.GuardProperties;
import com.vidnyan.guard.domain.model.RuleOptions;
import com.vidnyan.guard.domain.model.ValidationOptions;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads tool arguments and request options, filling gaps from {@link GuardProperties}.
 * Wrongly typed values raise {@link IllegalArgumentException}.
 */
@Component
@RequiredArgsConstructor
public class ToolArguments {
    
    private final GuardProperties properties;
    
    /**
     * Text value of {@code field}, or null when absent.
     */
    public static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isValueNode()) {
            throw new IllegalArgumentException("'" + field + "' must be a string");
        }
        return value.asText();
    }
    
    /**
     * Scan root: {@code path} when given (relative paths resolve against the project root),
     * otherwise the configured project root.
     */
    public Path projectRoot(JsonNode arguments) {
        Path defaultRoot = Path.of(properties.getProjectRoot());
        String path = text(arguments, "path");
        if (path == null || path.isBlank()) {
            return defaultRoot;
        }
        Path requested = Path.of(path);
        return requested.isAbsolute() ? requested : defaultRoot.resolve(requested).normalize();
    }
    
    public ValidationOptions options(JsonNode options) {
        if (options == null || options.isNull() || options.isMissingNode()) {
            return new ValidationOptions(List.of(), defaultRuleOptions(), false, false, List.of(), false);
        }
        if (!options.isObject()) {
            throw new IllegalArgumentException("'options' must be an object");
        }
        return new ValidationOptions(
                strings(options, "validators"),
                ruleOptions(options),
                flag(options, "includeDependencies"),
                flag(options, "strict"),
                strings(options, "ignorePatterns"),
                flag(options, "verbose")
        );
    }
    
    private RuleOptions ruleOptions(JsonNode options) {
        GuardProperties.Rules rules = properties.getRules();
        Integer maxLines = number(options, "maxLines");
        Integer warnLines = number(options, "warnLines");
        if (maxLines == null) {
            return new RuleOptions(rules.getMaxLines(), warnLines == null ? rules.getWarnLines() : warnLines);
        }
        // warnLines 0 lets RuleOptions derive 80% of maxLines
        return new RuleOptions(maxLines, warnLines == null ? 0 : warnLines);
    }
    
    private RuleOptions defaultRuleOptions() {
        return new RuleOptions(properties.getRules().getMaxLines(), properties.getRules().getWarnLines());
    }
    
    private static boolean flag(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return false;
        }
        if (!value.isBoolean()) {
            throw new IllegalArgumentException("'" + field + "' must be a boolean");
        }
        return value.booleanValue();
    }
    
    private static Integer number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt() || value.intValue() <= 0) {
            throw new IllegalArgumentException("'" + field + "' must be a positive integer");
        }
        return value.intValue();
    }
    
    private static List<String> strings(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        if (value.isTextual()) {
            for (String part : value.asText().split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
            return result;
        }
        if (!value.isArray()) {
            throw new IllegalArgumentException("'" + field + "' must be a list of strings");
        }
        value.forEach(item -> result.add(item.asText()));
        return result;
    }
}
