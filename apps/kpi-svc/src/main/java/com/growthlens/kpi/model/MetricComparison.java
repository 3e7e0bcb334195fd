package com.growthlens.kpi.model;

public record MetricComparison(Metric metric, Ratio current, Ratio previous, Ratio percentChange, boolean significant) {
}
