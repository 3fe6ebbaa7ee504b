package com.vidnyan.guard.domain.model;

import java.util.List;

/**
 * Dependency policy detail: every evaluated edge, split by decision.
 *
 * @param allowed edges as {@code "source -> target"}
 * @param denied  edges as {@code "source -> target"}
 * @param cycles  import cycles among project modules
 */
public record DependencyReport(
    List<String> allowed,
    List<String> denied,
    int importsChecked,
    List<List<String>> cycles
) implements ResultExtension {

    public DependencyReport {
        allowed = List.copyOf(allowed);
        denied = List.copyOf(denied);
        cycles = cycles.stream().map(List::copyOf).toList();
    }
}
