package com.vidnyan.guard.adapter.out.evaluator;

import com.vidnyan.guard.adapter.out.parser.SourceText;
import com.vidnyan.guard.domain.model.RuleOptions;
import com.vidnyan.guard.domain.model.RuleResult;
import com.vidnyan.guard.domain.model.SourcePath;
import com.vidnyan.guard.domain.rule.ArchitectureRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Suspense boundaries for streaming.
 * <p>
 * An error boundary defined in a parent layout or an {@code error.tsx} next to
 * the page is invisible to a single-file check, so the missing-boundary
 * warning can be a false positive.
 */
@Component
public class SuspenseRule implements ArchitectureRule {
    
    static final String NAME = "suspense";
    
    private static final Pattern FALLBACK = Pattern.compile("\\bfallback\\s*=");
    private static final Pattern EMPTY_FALLBACK = Pattern.compile(
            "\\bfallback\\s*=\\s*(?:\\{\\s*(?:null|undefined|<>\\s*</>|\"\"|''|``)?\\s*\\}|\"\"|'')");
    private static final Pattern AWAIT_FETCH = Pattern.compile("\\bawait\\s+fetch\\s*\\(");
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public String description() {
        return "Suspense boundaries have a fallback and an error boundary";
    }
    
    @Override
    public boolean appliesTo(SourcePath path) {
        return path.isComponentFile() && !path.isTestFile();
    }
    
    @Override
    public RuleResult check(SourcePath path, String content, RuleOptions options) {
        String code = SourceText.stripComments(content);
        List<JsxTags.Tag> boundaries = JsxTags.find(code, "Suspense");
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        
        for (JsxTags.Tag boundary : boundaries) {
            int line = SourceText.lineOf(code, boundary.offset());
            if (!FALLBACK.matcher(boundary.attributes()).find()) {
                errors.add("<Suspense> on line " + line + " has no fallback");
            } else if (EMPTY_FALLBACK.matcher(boundary.attributes()).find()) {
                warnings.add("<Suspense> on line " + line + " has an empty fallback");
            }
        }
        
        if (!boundaries.isEmpty() && !code.contains("ErrorBoundary")) {
            warnings.add("<Suspense> without an ErrorBoundary; failed fetches will bubble to the nearest error.tsx");
        }
        
        boolean client = ModuleDirectives.of(code).client();
        if (path.isPageOrLayout() && !client && boundaries.isEmpty() && AWAIT_FETCH.matcher(code).find()) {
            warnings.add("Server " + path.baseName() + " awaits fetch without a <Suspense> boundary; "
                    + "streaming waits for all data");
        }
        
        return RuleResult.of(errors, warnings);
    }
}
