package com.growthlens.kpi.model;

import java.util.Locale;

public record AnomalyRule(
        String name,
        Metric metric,
        ThresholdKind thresholdKind,
        double thresholdValue,
        Direction direction,
        Severity severity,
        int minBaselineDays
) {

    public AnomalyRule {
        if (metric == null) {
            throw new IllegalArgumentException("metric must be provided");
        }
        if (thresholdKind == null) {
            throw new IllegalArgumentException("thresholdKind must be provided");
        }
        if (direction == null) {
            throw new IllegalArgumentException("direction must be provided");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity must be provided");
        }
        if (Double.isNaN(thresholdValue) || thresholdValue < 0) {
            throw new IllegalArgumentException("thresholdValue must be a non-negative number");
        }
        if (minBaselineDays < 0) {
            throw new IllegalArgumentException("minBaselineDays must not be negative");
        }
        if (name == null || name.isBlank()) {
            name = metric.name().toLowerCase(Locale.ROOT) + "-" + direction.name().toLowerCase(Locale.ROOT)
                    + "-" + severity.name().toLowerCase(Locale.ROOT);
        }
    }
}
