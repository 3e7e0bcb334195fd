package com.growthlens.kpi.analytics;

/**
 * Plausible band for a metric; either bound may be open (null).
 */
public record MetricRange(Double min, Double max) {

    public MetricRange {
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("range min must not exceed max");
        }
    }

    public boolean contains(double value) {
        return (min == null || value >= min) && (max == null || value <= max);
    }
}
