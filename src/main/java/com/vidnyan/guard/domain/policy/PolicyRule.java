package com.vidnyan.guard.domain.policy;

import java.util.List;

/**
 * One clause of the dependency policy: modules matching {@code source}
 * may import {@code allow} targets and must not import {@code deny} targets.
 */
public record PolicyRule(
    String id,
    PathPattern source,
    List<PathPattern> allow,
    List<PathPattern> deny,
    String description
) {
    public PolicyRule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Policy rule id must not be blank");
        }
        if (source == null) {
            throw new IllegalArgumentException("Policy rule '" + id + "' has no source pattern");
        }
        allow = allow == null ? List.of() : List.copyOf(allow);
        deny = deny == null ? List.of() : List.copyOf(deny);
        description = description == null ? "" : description;
    }
    
    public boolean appliesTo(String sourceModule) {
        return source.matches(sourceModule);
    }
}
