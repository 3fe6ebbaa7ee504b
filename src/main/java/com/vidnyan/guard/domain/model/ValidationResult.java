package com.vidnyan.guard.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Base result shape shared by every validation.
 * Invariant: {@code success == errors.isEmpty()}.
 *
 * @param extra validator-specific detail, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationResult(
    boolean success,
    List<String> errors,
    List<String> warnings,
    String summary,
    ResultExtension extra
) implements ToolOutcome {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (success != errors.isEmpty()) {
            throw new IllegalArgumentException(
                    "success must be " + errors.isEmpty() + " for " + errors.size() + " error(s)");
        }
    }

    /**
     * Build a result whose success flag is derived from the error list.
     */
    public static ValidationResult of(List<String> errors, List<String> warnings, String summary,
                                      ResultExtension extra) {
        return new ValidationResult(errors.isEmpty(), errors, warnings, summary, extra);
    }

    /**
     * A result for a validation that could not run at all.
     */
    public static ValidationResult failure(String error, String summary) {
        return new ValidationResult(false, List.of(error), List.of(), summary, null);
    }
}
