package com.vidnyan.guard.adapter.out.evaluator;

import com.vidnyan.guard.domain.model.RuleOptions;
import com.vidnyan.guard.domain.model.RuleResult;
import com.vidnyan.guard.domain.model.SourcePath;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SizeRuleTest {

    private static final SourcePath FILE = SourcePath.of("components/dashboard.tsx");

    private final SizeRule rule = new SizeRule();

    private static String lines(int count) {
        return "const value = 1;\n".repeat(count);
    }

    @Test
    void check_ShouldFlagFilesAboveTheLimit() {
        RuleResult result = rule.check(FILE, lines(501), RuleOptions.defaults());

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).contains("size"));
        assertTrue(result.errors().get(0).contains("501"));
    }

    @Test
    void check_ShouldAcceptTheSameContentTruncated() {
        String truncated = lines(501).lines().limit(100).reduce("", (a, b) -> a + b + "\n");

        RuleResult result = rule.check(FILE, truncated, RuleOptions.defaults());

        assertTrue(result.isClean());
    }

    @Test
    void check_ShouldWarnBetweenWarnAndMaxLines() {
        RuleResult result = rule.check(FILE, lines(450), RuleOptions.defaults());

        assertTrue(result.errors().isEmpty());
        assertEquals(1, result.warnings().size());
    }

    @Test
    void check_ShouldDeriveWarnThresholdFromCallerMaxLines() {
        RuleResult result = rule.check(FILE, lines(90), new RuleOptions(100, 0));

        assertTrue(result.errors().isEmpty());
        assertEquals(1, result.warnings().size());
    }

    @Test
    void appliesTo_ShouldSkipDeclarationFiles() {
        assertFalse(rule.appliesTo(SourcePath.of("types/global.d.ts")));
        assertTrue(rule.appliesTo(SourcePath.of("lib/utils.ts")));
    }
}
