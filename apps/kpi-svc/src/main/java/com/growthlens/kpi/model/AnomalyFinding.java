package com.growthlens.kpi.model;

import java.time.LocalDate;
import java.util.Comparator;

public record AnomalyFinding(
        LocalDate date,
        Granularity granularity,
        String granularityKey,
        Metric metric,
        double observedValue,
        double baselineValue,
        Ratio percentChange,
        double absoluteChange,
        int baselineDays,
        Severity severity,
        AnomalyRule triggeringRule
) {

    /**
     * Severity descending, then absolute percent change descending (undefined last), then metric.
     */
    public static final Comparator<AnomalyFinding> PRESENTATION_ORDER = Comparator
            .comparing(AnomalyFinding::severity, Comparator.reverseOrder())
            .thenComparing(AnomalyFinding::magnitude, Comparator.reverseOrder())
            .thenComparing(AnomalyFinding::metric)
            .thenComparing(AnomalyFinding::granularity)
            .thenComparing(AnomalyFinding::granularityKey);

    private double magnitude() {
        return percentChange.isDefined() ? Math.abs(percentChange.value()) : -1d;
    }
}
