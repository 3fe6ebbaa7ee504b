package com.vidnyan.guard.domain.policy;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Ordered allow/deny rules plus an explicit default decision.
 * Evaluation is pure and deterministic:
 * <ol>
 *   <li>the most specific matching deny pattern denies</li>
 *   <li>otherwise the most specific matching allow pattern allows</li>
 *   <li>otherwise the default decision applies</li>
 * </ol>
 * Specificity is the literal character count of source plus target pattern.
 * Ties go to the rule that appears first.
 */
public record DependencyPolicy(List<PolicyRule> rules, DefaultDecision defaultDecision) {
    
    public DependencyPolicy {
        rules = List.copyOf(rules);
        if (defaultDecision == null) {
            throw new IllegalArgumentException("defaultDecision is required");
        }
    }
    
    public static DependencyPolicy allowAll() {
        return new DependencyPolicy(List.of(), DefaultDecision.ALLOW);
    }
    
    public EdgeDecision evaluate(String source, String target) {
        Optional<Match> deny = mostSpecific(source, target, PolicyRule::deny);
        if (deny.isPresent()) {
            return new EdgeDecision(source, target, false, deny.get().rule(), deny.get().pattern());
        }
        Optional<Match> allow = mostSpecific(source, target, PolicyRule::allow);
        if (allow.isPresent()) {
            return new EdgeDecision(source, target, true, allow.get().rule(), allow.get().pattern());
        }
        return new EdgeDecision(source, target, defaultDecision.allows(), null, null);
    }
    
    private Optional<Match> mostSpecific(String source, String target,
                                         Function<PolicyRule, List<PathPattern>> clause) {
        Match best = null;
        for (PolicyRule rule : rules) {
            if (!rule.appliesTo(source)) {
                continue;
            }
            for (PathPattern pattern : clause.apply(rule)) {
                if (!pattern.matches(target)) {
                    continue;
                }
                int score = rule.source().specificity() + pattern.specificity();
                // strictly greater keeps the earlier rule on ties
                if (best == null || score > best.score()) {
                    best = new Match(rule, pattern, score);
                }
            }
        }
        return Optional.ofNullable(best);
    }
    
    private record Match(PolicyRule rule, PathPattern pattern, int score) {}
}
