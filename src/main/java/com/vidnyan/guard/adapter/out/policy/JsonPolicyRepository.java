package com.vidnyan.guard.adapter.out.policy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guard.application.port.out.PolicyRepository;
import com.vidnyan.guard.config.GuardProperties;
import com.vidnyan.guard.domain.policy.DefaultDecision;
import com.vidnyan.guard.domain.policy.DependencyPolicy;
import com.vidnyan.guard.domain.policy.PathPattern;
import com.vidnyan.guard.domain.policy.PolicyRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Loads the dependency policy from a JSON document.
 * The location is a Spring resource ({@code classpath:}, {@code file:}) or a plain file path.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonPolicyRepository implements PolicyRepository {
    
    private final ObjectMapper objectMapper;
    private final GuardProperties properties;
    
    private volatile DependencyPolicy policy;
    
    @PostConstruct
    public void loadPolicy() {
        String location = location();
        Resource resource = resolve(location);
        if (!resource.exists()) {
            throw new PolicyLoadException("Dependency policy not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            PolicyDto dto = objectMapper.readValue(in, PolicyDto.class);
            policy = mapToPolicy(dto);
        } catch (IOException e) {
            throw new PolicyLoadException("Failed to read dependency policy " + location + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new PolicyLoadException("Invalid dependency policy " + location + ": " + e.getMessage(), e);
        }
        log.info("Loaded {} policy rules from {} (default: {})",
                policy.rules().size(), location, policy.defaultDecision());
    }
    
    @Override
    public DependencyPolicy load() {
        if (policy == null) {
            loadPolicy();
        }
        return policy;
    }
    
    @Override
    public String location() {
        return properties.getPolicy().getLocation();
    }
    
    private static Resource resolve(String location) {
        if (location.startsWith("classpath:") || location.startsWith("file:")) {
            return new DefaultResourceLoader().getResource(location);
        }
        return new FileSystemResource(location);
    }
    
    static DependencyPolicy mapToPolicy(PolicyDto dto) {
        if (dto.defaultDecision == null || dto.defaultDecision.isBlank()) {
            throw new IllegalArgumentException("defaultDecision is required (ALLOW or DENY)");
        }
        DefaultDecision decision = DefaultDecision.valueOf(dto.defaultDecision.trim().toUpperCase(Locale.ROOT));
        
        List<PolicyRule> rules = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        if (dto.rules != null) {
            for (PolicyRuleDto ruleDto : dto.rules) {
                PolicyRule rule = mapToRule(ruleDto);
                if (!ids.add(rule.id())) {
                    throw new IllegalArgumentException("Duplicate policy rule id: " + rule.id());
                }
                rules.add(rule);
            }
        }
        return new DependencyPolicy(rules, decision);
    }
    
    private static PolicyRule mapToRule(PolicyRuleDto dto) {
        if (dto.source == null) {
            throw new IllegalArgumentException("Policy rule '" + dto.id + "' has no source pattern");
        }
        return new PolicyRule(
                dto.id,
                PathPattern.of(dto.source),
                patterns(dto.allow),
                patterns(dto.deny),
                dto.description
        );
    }
    
    private static List<PathPattern> patterns(List<String> globs) {
        return globs == null ? List.of() : globs.stream().map(PathPattern::of).toList();
    }
    
    // DTOs for JSON parsing
    static class PolicyDto {
        public String defaultDecision;
        public List<PolicyRuleDto> rules;
    }
    
    static class PolicyRuleDto {
        public String id;
        public String source;
        public List<String> allow;
        public List<String> deny;
        public String description;
    }
}
