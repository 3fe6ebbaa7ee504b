package com.vidnyan.guard;

import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

import java.util.Arrays;
import java.util.Map;

/**
 * Architecture Guard - rule-based architecture and dependency validation.
 * 
 * Starts the HTTP tool server by default. {@code --stdio} serves the same tools over
 * stdin/stdout, and {@code --guard.analyze.path=<dir>} runs a single validation and exits.
 */
@SpringBootApplication
public class GuardApplication {

    public static void main(String[] args) {
        boolean stdio = Arrays.asList(args).contains("--stdio");
        boolean oneShot = Arrays.stream(args).anyMatch(arg -> arg.startsWith("--guard.analyze.path="));

        Map<String, Object> defaults = stdio ? Map.of("guard.transport", "stdio") : Map.of();

        new SpringApplicationBuilder(GuardApplication.class)
                .web(stdio || oneShot ? WebApplicationType.NONE : WebApplicationType.SERVLET)
                .properties(defaults)
                .run(args);
    }
}
