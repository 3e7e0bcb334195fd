package com.growthlens.kpi.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Detection outcome for one date. {@code rejections} is only known when the rollup was rebuilt in
 * the same run and is {@code null} otherwise; {@code sanityIssues} always reflect the stored rows.
 */
public record KpiReport(
        LocalDate date,
        RollupRow global,
        DetectionStatus status,
        List<AttributedFinding> findings,
        List<RuleSkip> skipped,
        List<MetricComparison> vsPreviousDay,
        PerformanceScore performance,
        List<RollupRow> osBreakdown,
        List<SanityIssue> sanityIssues,
        RejectionSummary rejections,
        String traceId
) {

    public KpiReport {
        findings = List.copyOf(findings);
        skipped = List.copyOf(skipped);
        vsPreviousDay = List.copyOf(vsPreviousDay);
        osBreakdown = List.copyOf(osBreakdown);
        sanityIssues = List.copyOf(sanityIssues);
    }

    public record AttributedFinding(AnomalyFinding finding, List<ContributionEntry> contributions) {

        public AttributedFinding {
            contributions = List.copyOf(contributions);
        }
    }
}
