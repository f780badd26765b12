package me.golemcore.context.domain.model;

import lombok.Builder;

import java.util.List;

/**
 * Report of one cleanup run. A failing pass contributes a {@code "<pass>: <reason>"}
 * entry to {@code errors} while the other passes still run.
 */
@Builder
public record CleanupReport(int expiredMidTerm, int danglingCount, int orphanedCount, List<String> errors) {

    public CleanupReport {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
