package com.vidnyan.guard.adapter.out.evaluator;

import com.vidnyan.guard.adapter.out.parser.SourceText;
import com.vidnyan.guard.domain.model.RuleOptions;
import com.vidnyan.guard.domain.model.RuleResult;
import com.vidnyan.guard.domain.model.SourcePath;
import com.vidnyan.guard.domain.rule.ArchitectureRule;
import org.springframework.stereotype.Component;

/**
 * File size limit. Counts physical lines, blank lines and comments included,
 * so generated or heavily commented files may be flagged.
 */
@Component
public class SizeRule implements ArchitectureRule {
    
    static final String NAME = "size";
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public String description() {
        return "Files stay below the configured line limits";
    }
    
    @Override
    public boolean appliesTo(SourcePath path) {
        return path.isSourceFile() && !path.isDeclarationFile();
    }
    
    @Override
    public RuleResult check(SourcePath path, String content, RuleOptions options) {
        int lines = SourceText.countLines(content);
        if (lines > options.maxLines()) {
            return RuleResult.error("File size of " + lines + " lines exceeds the maximum of "
                    + options.maxLines() + "; split it into smaller modules");
        }
        if (lines > options.warnLines()) {
            return RuleResult.warning("File size of " + lines
                    + " lines is approaching the maximum of " + options.maxLines());
        }
        return RuleResult.empty();
    }
}
