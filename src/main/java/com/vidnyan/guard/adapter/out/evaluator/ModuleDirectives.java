package com.vidnyan.guard.adapter.out.evaluator;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Directive prologue of a module ({@code "use client"} / {@code "use server"}).
 * Expects comment-stripped source.
 *
 * @param client         {@code "use client"} is in the leading prologue
 * @param server         {@code "use server"} is in the leading prologue
 * @param misplacedClient {@code "use client"} appears as a statement, but not in the prologue
 */
record ModuleDirectives(boolean client, boolean server, boolean misplacedClient) {
    
    private static final Pattern PROLOGUE_ENTRY = Pattern.compile("\\A\\s*(['\"])([^'\"\\n]*)\\1\\s*;?");
    private static final Pattern CLIENT_STATEMENT = Pattern.compile("(?m)^\\s*(['\"])use client\\1\\s*;?\\s*$");
    
    static ModuleDirectives of(String code) {
        boolean client = false;
        boolean server = false;
        int offset = 0;
        Matcher matcher = PROLOGUE_ENTRY.matcher(code);
        while (matcher.find()) {
            String directive = matcher.group(2);
            if ("use client".equals(directive)) {
                client = true;
            } else if ("use server".equals(directive)) {
                server = true;
            }
            offset = matcher.end();
            matcher.region(offset, code.length());
        }
        boolean misplaced = !client && CLIENT_STATEMENT.matcher(code.substring(offset)).find();
        return new ModuleDirectives(client, server, misplaced);
    }
}
