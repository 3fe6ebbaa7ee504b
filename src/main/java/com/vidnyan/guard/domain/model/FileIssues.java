package com.vidnyan.guard.domain.model;

import java.util.List;

/**
 * Issues found in a single file.
 */
public record FileIssues(String file, List<String> errors, List<String> warnings) {

    public FileIssues {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean passed() {
        return errors.isEmpty();
    }
}
