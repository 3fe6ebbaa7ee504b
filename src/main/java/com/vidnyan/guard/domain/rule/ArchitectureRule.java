package com.vidnyan.guard.domain.rule;

import com.vidnyan.guard.domain.model.RuleOptions;
import com.vidnyan.guard.domain.model.RuleResult;
import com.vidnyan.guard.domain.model.SourcePath;

/**
 * A single architectural concern evaluated against one file's content.
 * Implementations are pure: same path, content and options give the same result.
 */
public interface ArchitectureRule {
    
    /**
     * Stable rule name, used in messages and in {@code options.validators}.
     */
    String name();
    
    /**
     * Check if this rule inspects the given file at all.
     */
    boolean appliesTo(SourcePath path);
    
    /**
     * Evaluate the rule. Never throws for malformed content.
     */
    RuleResult check(SourcePath path, String content, RuleOptions options);
    
    /**
     * One-line description for logging and tool listings.
     */
    default String description() {
        return getClass().getSimpleName();
    }
}
