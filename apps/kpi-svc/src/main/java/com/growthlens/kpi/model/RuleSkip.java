package com.growthlens.kpi.model;

/**
 * A rule that could not be evaluated because the baseline had fewer valid days than it requires.
 */
public record RuleSkip(AnomalyRule rule, Granularity granularity, String granularityKey, int validDays) {
}
