package com.vidnyan.guard.domain.policy;

/**
 * Outcome of evaluating one import edge against the policy.
 *
 * @param rule    deciding rule, null when the default decision applied
 * @param pattern deciding target pattern, null when the default decision applied
 */
public record EdgeDecision(
    String source,
    String target,
    boolean allowed,
    PolicyRule rule,
    PathPattern pattern
) {
    
    public boolean byDefault() {
        return rule == null;
    }
    
    public String edge() {
        return source + " -> " + target;
    }
    
    /**
     * Short human-readable verdict.
     */
    public String message() {
        String verdict = allowed ? "allowed" : "denied";
        return "Import of '" + target + "' from '" + source + "' is " + verdict;
    }
    
    /**
     * Verdict plus the clause that decided it.
     */
    public String explanation() {
        if (byDefault()) {
            return message() + " by the default policy";
        }
        String text = message() + " by rule '" + rule.id() + "' (pattern '" + pattern.glob() + "')";
        return rule.description().isEmpty() ? text : text + ": " + rule.description();
    }
}
