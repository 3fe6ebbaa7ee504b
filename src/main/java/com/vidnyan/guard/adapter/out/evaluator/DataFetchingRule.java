package com.vidnyan.guard.adapter.out.evaluator;

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
 * Data fetching patterns for the App Router.
 * <p>
 * Server modules should cache fetches, fetch from async code, and batch
 * independent requests with {@code Promise.all}. Client modules should not
 * fetch during render and should prefer SWR or React Query.
 * <p>
 * Checks are file-wide: a {@code cache(} anywhere in the file counts for
 * every fetch in it (false negatives), and a fetch helper that is never
 * called during render is still reported (false positives).
 */
@Component
public class DataFetchingRule implements ArchitectureRule {
    
    static final String NAME = "data-fetching";
    
    private static final Pattern FETCH = Pattern.compile("(?<![.\\w$])fetch\\s*\\(");
    private static final Pattern CACHE_WRAPPER = Pattern.compile("\\b(?:cache|unstable_cache)\\s*\\(");
    private static final Pattern CACHE_OPTION = Pattern.compile("\\brevalidate\\b|\\bcache\\s*:");
    private static final Pattern ASYNC = Pattern.compile("\\basync\\b");
    private static final Pattern LEGACY_DATA_API = Pattern.compile("\\b(getServerSideProps|getStaticProps)\\b");
    private static final Pattern USE_EFFECT = Pattern.compile("\\buseEffect\\s*\\(");
    private static final Pattern QUERY_LIBRARY = Pattern.compile("\\b(?:useSWR\\w*|useQuery|useInfiniteQuery|useMutation)\\s*\\(");
    private static final Pattern RAW_SUPABASE_CLIENT = Pattern.compile("\\bcreateClient\\s*\\(");
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public String description() {
        return "Server fetches are cached and async, client fetches go through a data library";
    }
    
    @Override
    public boolean appliesTo(SourcePath path) {
        return path.isSourceFile() && !path.isDeclarationFile() && !path.isTestFile();
    }
    
    @Override
    public RuleResult check(SourcePath path, String content, RuleOptions options) {
        String code = SourceText.stripComments(content);
        ModuleDirectives directives = ModuleDirectives.of(code);
        int fetchCount = count(FETCH, code);
        
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        
        if (directives.client()) {
            checkClient(code, fetchCount, errors, warnings);
        } else {
            checkServer(path, code, fetchCount, errors, warnings);
        }
        return RuleResult.of(errors, warnings);
    }
    
    private void checkServer(SourcePath path, String code, int fetchCount,
                             List<String> errors, List<String> warnings) {
        if (fetchCount > 0) {
            if (!CACHE_WRAPPER.matcher(code).find() && !CACHE_OPTION.matcher(code).find()) {
                warnings.add("fetch without caching; wrap it in cache() or pass a cache or revalidate option");
            }
            if (!ASYNC.matcher(code).find() && !code.contains(".then(")) {
                errors.add("fetch called outside an async function or streaming boundary");
            }
            if (fetchCount > 1 && !code.contains("Promise.all")) {
                warnings.add(fetchCount + " fetch calls without Promise.all may create a request waterfall");
            }
        }
        
        if (path.startsWithDirectory("app")) {
            Matcher legacy = LEGACY_DATA_API.matcher(code);
            if (legacy.find()) {
                errors.add(legacy.group(1) + " is not supported in the App Router; "
                        + "fetch data in an async Server Component instead");
            }
        }
    }
    
    private void checkClient(String code, int fetchCount, List<String> errors, List<String> warnings) {
        boolean usesLibrary = QUERY_LIBRARY.matcher(code).find();
        boolean usesEffect = USE_EFFECT.matcher(code).find();
        
        if (fetchCount > 0 && !usesLibrary) {
            if (usesEffect) {
                warnings.add("fetch inside useEffect; prefer SWR or React Query for client data fetching");
            } else {
                errors.add("Client component calls fetch outside useEffect, SWR or React Query");
            }
        }
        
        if (RAW_SUPABASE_CLIENT.matcher(code).find() && !code.contains("createClientComponentClient")) {
            errors.add("Raw Supabase createClient() in a client component; use createClientComponentClient()");
        }
    }
    
    private static int count(Pattern pattern, String code) {
        Matcher matcher = pattern.matcher(code);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
