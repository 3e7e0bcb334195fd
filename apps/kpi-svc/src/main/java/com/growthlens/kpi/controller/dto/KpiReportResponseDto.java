package com.growthlens.kpi.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record KpiReportResponseDto(
        LocalDate date,
        String status,
        RollupResponseDto global,
        List<Finding> findings,
        List<SkippedRule> skipped,
        List<Comparison> vsPreviousDay,
        Performance performance,
        List<RollupResponseDto> osBreakdown,
        List<RollupBatchResponseDto.SanityIssue> sanityIssues,
        RollupBatchResponseDto.Rejections rejections,
        String traceId
) {
    public record Finding(
            String metric,
            String granularity,
            String key,
            BigDecimal observed,
            BigDecimal baseline,
            BigDecimal percentChange,
            BigDecimal absoluteChange,
            int baselineDays,
            String severity,
            String rule,
            List<Contribution> contributions) {
    }

    // deltas are in the metric's numerator units, minor units for money
    public record Contribution(String channel, long delta, long denominatorDelta, BigDecimal sharePercent, int rank) {
    }

    public record SkippedRule(String rule, String granularity, String key, int validDays) {
    }

    public record Performance(int score, int maxScore, String grade, List<PerformanceItem> items) {
    }

    public record PerformanceItem(String metric, BigDecimal value, int points, int maxPoints) {
    }

    public record Comparison(String metric, BigDecimal current, BigDecimal previous, BigDecimal percentChange, boolean significant) {
    }
}
