package com.vidnyan.guard.adapter.out.evaluator;

import com.vidnyan.guard.adapter.out.parser.ImportExtractor;
import com.vidnyan.guard.adapter.out.parser.SourceText;
import com.vidnyan.guard.domain.model.RuleOptions;
import com.vidnyan.guard.domain.model.RuleResult;
import com.vidnyan.guard.domain.model.SourcePath;
import com.vidnyan.guard.domain.rule.ArchitectureRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Component file structure: naming, exports and placement of client and
 * server modules in the directory tree.
 * <p>
 * Re-exports through {@code export *} count as exports, so barrel files pass.
 * Default exports assembled at runtime ({@code export default withAuth(Page)})
 * are not checked for PascalCase (false negative).
 */
@Component
public class StructureRule implements ArchitectureRule {
    
    static final String NAME = "structure";
    
    private static final Pattern KEBAB_CASE = Pattern.compile("[a-z0-9]+(?:-[a-z0-9]+)*(?:\\.[a-z0-9]+(?:-[a-z0-9]+)*)*");
    private static final Pattern PASCAL_CASE = Pattern.compile("[A-Z][A-Za-z0-9]*");
    private static final Pattern DEFAULT_EXPORT = Pattern.compile("\\bexport\\s+default\\b");
    private static final Pattern NAMED_DEFAULT_FUNCTION = Pattern.compile(
            "\\bexport\\s+default\\s+(?:async\\s+)?function\\s*\\*?\\s*([A-Za-z_$][\\w$]*)");
    private static final Pattern ANONYMOUS_DEFAULT = Pattern.compile(
            "\\bexport\\s+default\\s+(?:(?:async\\s+)?function\\s*\\*?\\s*\\(|(?:async\\s+)?\\([^)]*\\)\\s*=>|(?:async\\s+)?[A-Za-z_$][\\w$]*\\s*=>|class\\s*\\{)");
    private static final Pattern ANY_EXPORT = Pattern.compile("\\bexport\\b|\\bmodule\\.exports\\b");
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public String description() {
        return "Component files are kebab-case, export a PascalCase component and sit in the right place";
    }
    
    @Override
    public boolean appliesTo(SourcePath path) {
        return path.isComponentFile() && !path.isTestFile();
    }
    
    @Override
    public RuleResult check(SourcePath path, String content, RuleOptions options) {
        String code = SourceText.stripComments(content);
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        
        if ("jsx".equals(path.extension())) {
            warnings.add("Use .tsx instead of .jsx for components");
        }
        if (!KEBAB_CASE.matcher(path.baseName()).matches()) {
            warnings.add("File name '" + path.fileName() + "' is not kebab-case");
        }
        
        checkExports(path, code, errors, warnings);
        checkPlacement(path, code, errors, warnings);
        
        return RuleResult.of(errors, warnings);
    }
    
    private void checkExports(SourcePath path, String code, List<String> errors, List<String> warnings) {
        boolean hasDefault = DEFAULT_EXPORT.matcher(code).find();
        if (path.isRouteModule() && !hasDefault) {
            errors.add("Route module '" + path.baseName() + "' must have a default export");
        }
        if (ANONYMOUS_DEFAULT.matcher(code).find()) {
            warnings.add("Anonymous default export; name the component so it shows up in stack traces and DevTools");
        }
        Matcher named = NAMED_DEFAULT_FUNCTION.matcher(code);
        if (named.find() && !PASCAL_CASE.matcher(named.group(1)).matches()) {
            errors.add("Default-exported component '" + named.group(1) + "' must be PascalCase");
        }
        if (!ANY_EXPORT.matcher(code).find()) {
            warnings.add("File has no exports");
        }
    }
    
    private void checkPlacement(SourcePath path, String code, List<String> errors, List<String> warnings) {
        ModuleDirectives directives = ModuleDirectives.of(code);
        boolean serverOnly = directives.server() || ImportExtractor.extract(code).contains("server-only");
        boolean clientLocation = path.inDirectory("client") || path.baseName().endsWith("-client");
        
        if (directives.client() && path.inDirectory("server")) {
            errors.add("Client component placed under a server/ directory");
        }
        if (serverOnly && clientLocation) {
            errors.add("Server-only module placed in a client location");
        }
        if (directives.client() && !clientLocation && !path.inDirectory("ui") && !path.isRouteModule()) {
            warnings.add("Client component should use the -client suffix or live under client/ or ui/");
        }
    }
}
