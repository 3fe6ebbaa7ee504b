package com.vidnyan.guard.adapter.out.parser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex extraction of import specifiers.
 * Misses specifiers built at runtime and may report imports that only
 * appear inside string or template literals.
 */
public final class ImportExtractor {
    
    private static final List<Pattern> PATTERNS = List.of(
            // import x from 'y', import { a, b } from "y", import type { T } from 'y'
            Pattern.compile("\\bimport\\s+(?!\\()[^'\";]*?\\bfrom\\s*['\"]([^'\"\\n]+)['\"]"),
            // import 'y'
            Pattern.compile("\\bimport\\s*['\"]([^'\"\\n]+)['\"]"),
            // export * from 'y', export { a } from 'y'
            Pattern.compile("\\bexport\\s+(?:type\\s+)?(?:\\*(?:\\s+as\\s+[\\w$]+)?|\\{[^}]*\\})\\s*from\\s*['\"]([^'\"\\n]+)['\"]"),
            // require('y')
            Pattern.compile("\\brequire\\s*\\(\\s*['\"]([^'\"\\n]+)['\"]\\s*\\)"),
            // import('y')
            Pattern.compile("\\bimport\\s*\\(\\s*['\"]([^'\"\\n]+)['\"]\\s*\\)")
    );
    
    private ImportExtractor() {
    }
    
    /**
     * Distinct specifiers in order of first appearance.
     */
    public static List<String> extract(String content) {
        String code = SourceText.stripComments(content);
        List<Found> found = new ArrayList<>();
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(code);
            while (matcher.find()) {
                found.add(new Found(matcher.start(1), matcher.group(1).trim()));
            }
        }
        found.sort(Comparator.comparingInt(Found::offset));
        
        Set<String> specifiers = new LinkedHashSet<>();
        for (Found f : found) {
            if (!f.specifier().isEmpty()) {
                specifiers.add(f.specifier());
            }
        }
        return List.copyOf(specifiers);
    }
    
    private record Found(int offset, String specifier) {}
}
