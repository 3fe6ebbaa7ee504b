package com.vidnyan.guard.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Orchestrator detail: per-file issues and file counts.
 *
 * @param componentIssues files that produced at least one error or warning
 * @param dependencies    present only when the dependency check ran as part of the validation
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProjectReport(
    List<FileIssues> componentIssues,
    int filesScanned,
    int filesPassed,
    int filesFailed,
    List<String> validators,
    DependencyReport dependencies
) implements ResultExtension {

    public ProjectReport {
        componentIssues = List.copyOf(componentIssues);
        validators = List.copyOf(validators);
    }
}
