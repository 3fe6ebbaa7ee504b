package com.vidnyan.guard.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.guard.adapter.in.tool.ToolCatalog;
import com.vidnyan.guard.adapter.in.tool.ToolKind;
import com.vidnyan.guard.adapter.in.tool.ToolRegistry;
import com.vidnyan.guard.domain.rule.ArchitectureRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for Architecture Guard components.
 */
@Slf4j
@Configuration
public class GuardConfiguration {
    
    /**
     * ObjectMapper for JSON parsing. Single-line output keeps stdio responses one per line.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
    }
    
    /**
     * Registry shared by the HTTP and stdio transports.
     */
    @Bean
    public ToolRegistry toolRegistry(ToolCatalog catalog, GuardProperties properties) {
        ToolRegistry.Builder builder = ToolRegistry.builder();
        catalog.definitions().forEach(builder::register);
        for (String name : properties.getTools().getDisabled()) {
            ToolKind.fromName(name).ifPresentOrElse(
                    builder::disable,
                    () -> log.warn("Ignoring unknown tool in guard.tools.disabled: {}", name));
        }
        ToolRegistry registry = builder.build();
        log.info("Registered {} tools:", registry.size());
        registry.all().forEach(tool -> log.info("  - {}{}", tool.name(),
                registry.isEnabled(tool.kind()) ? "" : " (disabled)"));
        return registry;
    }
    
    /**
     * Log available rules on startup.
     */
    @Bean
    public String logRules(List<ArchitectureRule> rules) {
        log.info("Registered {} architecture rules:", rules.size());
        rules.forEach(rule -> log.info("  - {}: {}", rule.name(), rule.description()));
        return "rules-logged";
    }
}
