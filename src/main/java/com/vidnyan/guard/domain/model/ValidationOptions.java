package com.vidnyan.guard.domain.model;

import java.util.List;

/**
 * Caller-supplied options shared by every validation entry point.
 *
 * @param validators          rule names to run; empty means all
 * @param ruleOptions         thresholds handed to each rule
 * @param includeDependencies also run the dependency policy check
 * @param strict              promote warnings to errors (CI mode)
 * @param ignorePatterns      globs of project paths to skip
 * @param verbose             explain which policy clause decided an edge
 */
public record ValidationOptions(
    List<String> validators,
    RuleOptions ruleOptions,
    boolean includeDependencies,
    boolean strict,
    List<String> ignorePatterns,
    boolean verbose
) {
    public ValidationOptions {
        validators = validators == null ? List.of() : List.copyOf(validators);
        ruleOptions = ruleOptions == null ? RuleOptions.defaults() : ruleOptions;
        ignorePatterns = ignorePatterns == null ? List.of() : List.copyOf(ignorePatterns);
    }
    
    public static ValidationOptions defaults() {
        return new ValidationOptions(List.of(), RuleOptions.defaults(), false, false, List.of(), false);
    }
    
    public ValidationOptions withStrict(boolean strict) {
        return new ValidationOptions(validators, ruleOptions, includeDependencies, strict, ignorePatterns, verbose);
    }
}
