package com.growthlens.kpi.model;

import java.time.LocalDate;

/**
 * Aggregated KPIs for one (date, granularity, key). Only integer sums are stored; ratios are
 * derived on access. Money sums are minor units.
 */
public record RollupRow(
        LocalDate date,
        Granularity granularity,
        String granularityKey,
        long qualityUsers,
        long allUsers,
        long goodUsers,
        long verifiedUsers,
        long retainedUsers,
        long payingUsers,
        long femaleUsers,
        long youngUsers,
        long highTierUsers,
        long totalRevenue,
        long totalCost
) {

    public RollupRow {
        if (date == null) {
            throw new IllegalArgumentException("date must be provided");
        }
        if (granularity == null) {
            throw new IllegalArgumentException("granularity must be provided");
        }
        if (granularityKey == null) {
            throw new IllegalArgumentException("granularityKey must not be null");
        }
    }

    public static RollupRow empty(LocalDate date, Granularity granularity, String granularityKey) {
        return new RollupRow(date, granularity, granularityKey, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    public boolean isGlobal() {
        return granularity == Granularity.GLOBAL;
    }

    public Ratio goodRate() {
        return Metric.GOOD_RATE.valueOf(this);
    }

    public Ratio verifiedRate() {
        return Metric.VERIFIED_RATE.valueOf(this);
    }

    public Ratio qualityRate() {
        return Metric.QUALITY_RATE.valueOf(this);
    }

    public Ratio retentionRate() {
        return Metric.RETENTION_RATE.valueOf(this);
    }

    public Ratio conversionRate() {
        return Metric.CONVERSION_RATE.valueOf(this);
    }

    public Ratio arpu() {
        return Metric.ARPU.valueOf(this);
    }

    public Ratio cpa() {
        return Metric.CPA.valueOf(this);
    }

    public Ratio femaleRatio() {
        return Metric.FEMALE_RATIO.valueOf(this);
    }

    public Ratio youngRatio() {
        return Metric.YOUNG_RATIO.valueOf(this);
    }

    public Ratio highTierRatio() {
        return Metric.HIGH_TIER_RATIO.valueOf(this);
    }
}
