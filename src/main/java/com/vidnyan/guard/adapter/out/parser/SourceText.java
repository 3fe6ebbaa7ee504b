package com.vidnyan.guard.adapter.out.parser;

/**
 * Text helpers for TS/JS sources. Not a tokenizer: template literal
 * interpolation and regex literals are treated as plain string content.
 */
public final class SourceText {
    
    private SourceText() {
    }
    
    /**
     * Replace comments with spaces, keeping newlines and string literals intact,
     * so offsets and line numbers still line up with the original.
     */
    public static String stripComments(String content) {
        StringBuilder out = new StringBuilder(content.length());
        int length = content.length();
        char quote = 0;
        int i = 0;
        while (i < length) {
            char c = content.charAt(i);
            char next = i + 1 < length ? content.charAt(i + 1) : 0;
            if (quote != 0) {
                out.append(c);
                if (c == '\\' && i + 1 < length) {
                    out.append(next);
                    i += 2;
                    continue;
                }
                if (c == quote || (c == '\n' && quote != '`')) {
                    quote = 0;
                }
                i++;
            } else if (c == '/' && next == '/') {
                while (i < length && content.charAt(i) != '\n') {
                    out.append(' ');
                    i++;
                }
            } else if (c == '/' && next == '*') {
                int end = content.indexOf("*/", i + 2);
                int stop = end < 0 ? length : end + 2;
                for (; i < stop; i++) {
                    out.append(content.charAt(i) == '\n' ? '\n' : ' ');
                }
            } else {
                if (c == '"' || c == '\'' || c == '`') {
                    quote = c;
                }
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }
    
    /**
     * 1-based line number of an offset.
     */
    public static int lineOf(String content, int offset) {
        int line = 1;
        int limit = Math.min(offset, content.length());
        for (int i = 0; i < limit; i++) {
            if (content.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
    
    /**
     * Number of lines, counting a final line without a newline.
     */
    public static int countLines(String content) {
        if (content.isEmpty()) {
            return 0;
        }
        int lines = 1;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                lines++;
            }
        }
        return content.endsWith("\n") ? lines - 1 : lines;
    }
}
