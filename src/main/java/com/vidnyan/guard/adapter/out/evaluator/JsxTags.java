package com.vidnyan.guard.adapter.out.evaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds opening JSX tags by name. Braces are balanced so arrow functions
 * inside attribute expressions do not end the tag early; string literals
 * containing braces can still confuse it.
 */
final class JsxTags {
    
    private JsxTags() {
    }
    
    /**
     * @param offset     offset of the {@code <}
     * @param attributes text between the tag name and the closing {@code >} or {@code />}
     */
    record Tag(int offset, String attributes) {}
    
    static List<Tag> find(String code, String name) {
        List<Tag> tags = new ArrayList<>();
        Matcher matcher = Pattern.compile("<" + Pattern.quote(name) + "(?=[\\s/>])").matcher(code);
        while (matcher.find()) {
            int start = matcher.end();
            int depth = 0;
            int i = start;
            while (i < code.length()) {
                char c = code.charAt(i);
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth = Math.max(0, depth - 1);
                } else if (c == '>' && depth == 0) {
                    break;
                }
                i++;
            }
            String attributes = code.substring(start, i);
            if (attributes.endsWith("/")) {
                attributes = attributes.substring(0, attributes.length() - 1);
            }
            tags.add(new Tag(matcher.start(), attributes));
        }
        return tags;
    }
}
