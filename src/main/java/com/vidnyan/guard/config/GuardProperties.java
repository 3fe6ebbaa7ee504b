package com.vidnyan.guard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from the {@code guard.*} namespace.
 */
@Data
@Component
@ConfigurationProperties(prefix = "guard")
public class GuardProperties {
    
    /**
     * Default scan root when a request omits {@code path}.
     */
    private String projectRoot = ".";
    
    /**
     * {@code http} or {@code stdio}.
     */
    private String transport = "http";
    
    private Scan scan = new Scan();
    private Rules rules = new Rules();
    private Policy policy = new Policy();
    private Tools tools = new Tools();
    private Analyze analyze = new Analyze();
    
    @Data
    public static class Scan {
        private List<String> extensions = new ArrayList<>(List.of(".ts", ".tsx", ".js", ".jsx"));
        private List<String> excludedDirectories = new ArrayList<>(
                List.of("node_modules", ".next", "out", "dist", "build", "coverage"));
    }
    
    @Data
    public static class Rules {
        private int maxLines = 500;
        private int warnLines = 400;
    }
    
    @Data
    public static class Policy {
        private String location = "classpath:policy/dependency-policy.json";
    }
    
    @Data
    public static class Tools {
        /**
         * Tool names that start disabled.
         */
        private List<String> disabled = new ArrayList<>();
    }
    
    @Data
    public static class Analyze {
        /**
         * One-shot CLI target; blank means serve instead.
         */
        private String path = "";
    }
}
