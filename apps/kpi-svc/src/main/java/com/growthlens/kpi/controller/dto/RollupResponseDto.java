package com.growthlens.kpi.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One rollup row. Money is in major units; a ratio whose denominator was zero is {@code null}.
 */
public record RollupResponseDto(
        LocalDate date,
        String granularity,
        String key,
        Counts counts,
        BigDecimal totalRevenue,
        BigDecimal totalCost,
        Ratios ratios
) {
    public record Counts(
            long qualityUsers,
            long allUsers,
            long goodUsers,
            long verifiedUsers,
            long retainedUsers,
            long payingUsers,
            long femaleUsers,
            long youngUsers,
            long highTierUsers) {
    }

    public record Ratios(
            BigDecimal goodRate,
            BigDecimal verifiedRate,
            BigDecimal qualityRate,
            BigDecimal retentionRate,
            BigDecimal conversionRate,
            BigDecimal arpu,
            BigDecimal cpa,
            BigDecimal femaleRatio,
            BigDecimal youngRatio,
            BigDecimal highTierRatio) {
    }
}
