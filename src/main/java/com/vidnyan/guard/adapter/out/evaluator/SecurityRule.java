package com.vidnyan.guard.adapter.out.evaluator;

import com.vidnyan.guard.adapter.out.parser.SourceText;
import com.vidnyan.guard.domain.model.RuleOptions;
import com.vidnyan.guard.domain.model.RuleResult;
import com.vidnyan.guard.domain.model.SourcePath;
import com.vidnyan.guard.domain.rule.ArchitectureRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Hardcoded secrets, and server environment variables read by client modules.
 * <p>
 * Declarations may carry a simple type annotation ({@code const apiKey: string = "..."}).
 * Long literals assigned to names like {@code passwordLabel} are reported
 * (false positive). Secrets assembled by concatenation, assigned through
 * object-literal or function types, or split across lines are not (false negatives).
 */
@Component
public class SecurityRule implements ArchitectureRule {
    
    static final String NAME = "security";
    
    private static final List<Pattern> SECRETS = List.of(
            Pattern.compile("(?i)\\b(?:const|let|var)\\s+[\\w$]*(?:api_?key|secret|password|passwd|token)[\\w$]*"
                    + "(?:\\s*:\\s*[\\w$<>\\[\\]|. ]+?)?\\s*=\\s*[\"'`][^\"'`\\s$]{8,}[\"'`]"),
            Pattern.compile("(?i)[\"']?[\\w$]*(?:api_?key|secret|password|passwd)[\\w$]*[\"']?\\s*:\\s*[\"'`][^\"'`\\s$]{8,}[\"'`]"),
            Pattern.compile("[\"'`]Bearer\\s+[A-Za-z0-9._~+/=-]{8,}[\"'`]")
    );
    private static final Pattern ENV_READ = Pattern.compile("\\bprocess\\.env\\.([A-Za-z_][A-Za-z0-9_]*)");
    private static final Set<String> INLINED_ENV = Set.of("NODE_ENV");
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public String description() {
        return "No hardcoded secrets, no server environment variables in client code";
    }
    
    @Override
    public boolean appliesTo(SourcePath path) {
        return path.isSourceFile() && !path.isDeclarationFile() && !path.isTestFile();
    }
    
    @Override
    public RuleResult check(SourcePath path, String content, RuleOptions options) {
        String code = SourceText.stripComments(content);
        List<String> errors = new ArrayList<>();
        
        Set<Integer> secretLines = new TreeSet<>();
        for (Pattern pattern : SECRETS) {
            Matcher matcher = pattern.matcher(code);
            while (matcher.find()) {
                secretLines.add(SourceText.lineOf(code, matcher.start()));
            }
        }
        secretLines.forEach(line -> errors.add(
                "Possible hardcoded secret on line " + line + "; read it from an environment variable"));
        
        if (ModuleDirectives.of(code).client()) {
            Set<String> serverVariables = new TreeSet<>();
            Matcher env = ENV_READ.matcher(code);
            while (env.find()) {
                String variable = env.group(1);
                if (!variable.startsWith("NEXT_PUBLIC_") && !INLINED_ENV.contains(variable)) {
                    serverVariables.add(variable);
                }
            }
            serverVariables.forEach(variable -> errors.add("Client module reads server-only environment variable "
                    + variable + "; only NEXT_PUBLIC_ variables reach the browser"));
        }
        
        return RuleResult.of(errors, List.of());
    }
}
