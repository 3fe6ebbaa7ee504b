package com.vidnyan.guard.domain.model;

/**
 * Options bag handed to every rule.
 *
 * @param maxLines  size above which a file is an error
 * @param warnLines size above which a file is a warning
 */
public record RuleOptions(int maxLines, int warnLines) {

    public static final int DEFAULT_MAX_LINES = 500;
    public static final int DEFAULT_WARN_LINES = 400;

    public RuleOptions {
        if (maxLines <= 0) {
            maxLines = DEFAULT_MAX_LINES;
        }
        if (warnLines <= 0 || warnLines > maxLines) {
            warnLines = maxLines * 4 / 5;
        }
    }

    public static RuleOptions defaults() {
        return new RuleOptions(DEFAULT_MAX_LINES, DEFAULT_WARN_LINES);
    }
}
