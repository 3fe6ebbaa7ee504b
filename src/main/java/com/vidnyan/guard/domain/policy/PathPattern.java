package com.vidnyan.guard.domain.policy;

import java.util.regex.Pattern;

/**
 * Glob over module paths and package names.
 * <ul>
 *   <li>{@code *} matches within one path segment</li>
 *   <li>{@code **} matches any number of segments</li>
 *   <li>{@code ?} matches one character other than {@code /}</li>
 * </ul>
 */
public final class PathPattern {
    
    private final String glob;
    private final Pattern regex;
    private final int specificity;
    
    private PathPattern(String glob) {
        this.glob = glob;
        this.regex = Pattern.compile(toRegex(glob));
        this.specificity = countLiterals(glob);
    }
    
    public static PathPattern of(String glob) {
        if (glob == null || glob.isBlank()) {
            throw new IllegalArgumentException("Pattern must not be blank");
        }
        return new PathPattern(glob.trim());
    }
    
    public boolean matches(String path) {
        return regex.matcher(path).matches();
    }
    
    /**
     * Number of literal characters; higher means more specific.
     */
    public int specificity() {
        return specificity;
    }
    
    public String glob() {
        return glob;
    }
    
    static String toRegex(String glob) {
        if (glob.length() > 3 && glob.endsWith("/**")) {
            // trailing "/**" also matches the directory itself
            return toRegex(glob.substring(0, glob.length() - 3)) + "(?:/.*)?";
        }
        StringBuilder regex = new StringBuilder();
        int length = glob.length();
        int i = 0;
        while (i < length) {
            char c = glob.charAt(i);
            if (c == '*') {
                boolean doubleStar = i + 1 < length && glob.charAt(i + 1) == '*';
                if (!doubleStar) {
                    regex.append("[^/]*");
                    i++;
                    continue;
                }
                boolean atSegmentStart = i == 0 || glob.charAt(i - 1) == '/';
                boolean followedBySlash = i + 2 < length && glob.charAt(i + 2) == '/';
                if (atSegmentStart && followedBySlash) {
                    // "**/" also matches zero directories
                    regex.append("(?:.*/)?");
                    i += 3;
                } else {
                    regex.append(".*");
                    i += 2;
                }
            } else if (c == '?') {
                regex.append("[^/]");
                i++;
            } else {
                int next = i;
                while (next < length && glob.charAt(next) != '*' && glob.charAt(next) != '?') {
                    next++;
                }
                regex.append(Pattern.quote(glob.substring(i, next)));
                i = next;
            }
        }
        return regex.toString();
    }
    
    private static int countLiterals(String glob) {
        int count = 0;
        for (char c : glob.toCharArray()) {
            if (c != '*' && c != '?') {
                count++;
            }
        }
        return count;
    }
    
    @Override
    public boolean equals(Object o) {
        return o instanceof PathPattern other && glob.equals(other.glob);
    }
    
    @Override
    public int hashCode() {
        return glob.hashCode();
    }
    
    @Override
    public String toString() {
        return glob;
    }
}
