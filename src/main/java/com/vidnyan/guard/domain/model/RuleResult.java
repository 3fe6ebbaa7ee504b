package com.vidnyan.guard.domain.model;

import java.util.List;

/**
 * Output of one rule applied to one file.
 */
public record RuleResult(List<String> errors, List<String> warnings) {

    private static final RuleResult EMPTY = new RuleResult(List.of(), List.of());

    public RuleResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static RuleResult empty() {
        return EMPTY;
    }

    public static RuleResult of(List<String> errors, List<String> warnings) {
        return errors.isEmpty() && warnings.isEmpty() ? EMPTY : new RuleResult(errors, warnings);
    }

    public static RuleResult error(String message) {
        return new RuleResult(List.of(message), List.of());
    }

    public static RuleResult warning(String message) {
        return new RuleResult(List.of(), List.of(message));
    }

    public boolean isClean() {
        return errors.isEmpty() && warnings.isEmpty();
    }
}
