package me.golemcore.context.domain.model;

import lombok.Builder;

import java.util.List;

/**
 * Report of one promotion run.
 */
@Builder
public record PromotionReport(int candidates, int promoted, int skipped, int embeddingFailures,
        List<String> errors) {

    public PromotionReport {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static PromotionReport disabled() {
        return new PromotionReport(0, 0, 0, 0, List.of());
    }
}
