package com.vidnyan.guard.adapter.out.evaluator;

import com.vidnyan.guard.adapter.out.parser.ImportExtractor;
import com.vidnyan.guard.adapter.out.parser.SourceText;
import com.vidnyan.guard.domain.model.RuleOptions;
import com.vidnyan.guard.domain.model.RuleResult;
import com.vidnyan.guard.domain.model.SourcePath;
import com.vidnyan.guard.domain.rule.ArchitectureRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Server/client component boundary.
 * <p>
 * Flags client-only capabilities (state and effect hooks, browser globals,
 * DOM event handler props) in modules without a leading {@code "use client"},
 * a misplaced directive, a directive with nothing interactive behind it, and
 * client modules importing {@code server-only}.
 * <p>
 * False positives: a local variable named {@code window}, or hooks mentioned
 * inside string literals. False negatives: capabilities reached through a
 * custom hook imported from another module.
 */
@Component
public class BoundaryRule implements ArchitectureRule {
    
    static final String NAME = "boundary";
    
    private static final Pattern HOOK = Pattern.compile(
            "\\b(useState|useReducer|useEffect|useLayoutEffect|useInsertionEffect|useRef|useCallback|useMemo"
                    + "|useContext|useTransition|useDeferredValue|useSyncExternalStore|useImperativeHandle"
                    + "|useOptimistic|useActionState|useFormStatus"
                    + "|useRouter|usePathname|useSearchParams|useParams)\\s*\\(");
    private static final Pattern BROWSER_GLOBAL = Pattern.compile(
            "\\b(window|document|navigator)\\s*\\.|\\b(localStorage|sessionStorage)\\b"
                    + "|\\b(addEventListener|removeEventListener|requestAnimationFrame)\\s*\\(");
    private static final Pattern EVENT_HANDLER = Pattern.compile("\\s(on[A-Z][A-Za-z]*)\\s*=\\s*\\{");
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public String description() {
        return "Client-only features require a leading \"use client\" directive";
    }
    
    @Override
    public boolean appliesTo(SourcePath path) {
        return path.isComponentFile();
    }
    
    @Override
    public RuleResult check(SourcePath path, String content, RuleOptions options) {
        String code = SourceText.stripComments(content);
        ModuleDirectives directives = ModuleDirectives.of(code);
        Set<String> features = clientFeatures(code);
        
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        
        if (directives.misplacedClient()) {
            errors.add("\"use client\" must be the first statement in the file");
        } else if (!directives.client() && !features.isEmpty()) {
            errors.add("Uses client-only features (" + summarize(features)
                    + ") without a leading \"use client\" directive");
        }
        
        if (directives.client() && features.isEmpty()) {
            warnings.add("Has a \"use client\" directive but uses no client-only features; "
                    + "it could be a Server Component");
        }
        
        if (directives.client() && ImportExtractor.extract(code).contains("server-only")) {
            errors.add("Client module imports 'server-only'");
        }
        
        return RuleResult.of(errors, warnings);
    }
    
    private static Set<String> clientFeatures(String code) {
        Set<String> features = new LinkedHashSet<>();
        collect(HOOK.matcher(code), features);
        Matcher browser = BROWSER_GLOBAL.matcher(code);
        while (browser.find()) {
            for (int group = 1; group <= browser.groupCount(); group++) {
                if (browser.group(group) != null) {
                    features.add(browser.group(group));
                }
            }
        }
        collect(EVENT_HANDLER.matcher(code), features);
        return features;
    }
    
    private static void collect(Matcher matcher, Set<String> into) {
        while (matcher.find()) {
            into.add(matcher.group(1));
        }
    }
    
    private static String summarize(Set<String> features) {
        List<String> shown = features.stream().limit(3).toList();
        String text = String.join(", ", shown);
        return features.size() > shown.size() ? text + ", ..." : text;
    }
}
