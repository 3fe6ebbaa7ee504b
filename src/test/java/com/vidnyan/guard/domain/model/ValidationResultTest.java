package com.vidnyan.guard.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValidationResultTest {

    @Test
    void constructor_ShouldRejectSuccessWithErrors() {
        assertThrows(IllegalArgumentException.class,
                () -> new ValidationResult(true, List.of("broken"), List.of(), "summary", null));
        assertThrows(IllegalArgumentException.class,
                () -> new ValidationResult(false, List.of(), List.of(), "summary", null));
    }

    @Test
    void of_ShouldDeriveSuccessFromErrors() {
        assertTrue(ValidationResult.of(List.of(), List.of("just a warning"), "ok", null).success());
        assertFalse(ValidationResult.of(List.of("broken"), List.of(), "failed", null).success());
    }

    @Test
    void ruleOptions_ShouldDeriveWarnThresholdFromMaxLines() {
        RuleOptions options = new RuleOptions(100, 0);

        assertEquals(100, options.maxLines());
        assertEquals(80, options.warnLines());
        assertEquals(RuleOptions.DEFAULT_WARN_LINES, RuleOptions.defaults().warnLines());
    }
}
