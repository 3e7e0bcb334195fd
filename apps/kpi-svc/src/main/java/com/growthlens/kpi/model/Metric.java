package com.growthlens.kpi.model;

import com.growthlens.kpi.money.Ratios;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.function.ToLongFunction;

/**
 * Monitorable KPIs. Absolute metrics have no denominator. Monetary values are presented in
 * major units, rates as fractions.
 */
public enum Metric {
    ALL_USERS(RollupRow::allUsers, null, false),
    QUALITY_USERS(RollupRow::qualityUsers, null, false),
    GOOD_USERS(RollupRow::goodUsers, null, false),
    VERIFIED_USERS(RollupRow::verifiedUsers, null, false),
    RETAINED_USERS(RollupRow::retainedUsers, null, false),
    PAYING_USERS(RollupRow::payingUsers, null, false),
    TOTAL_REVENUE(RollupRow::totalRevenue, null, true),
    TOTAL_COST(RollupRow::totalCost, null, true),
    GOOD_RATE(RollupRow::goodUsers, RollupRow::allUsers, false),
    VERIFIED_RATE(RollupRow::verifiedUsers, RollupRow::allUsers, false),
    QUALITY_RATE(RollupRow::qualityUsers, RollupRow::allUsers, false),
    RETENTION_RATE(RollupRow::retainedUsers, RollupRow::qualityUsers, false),
    CONVERSION_RATE(RollupRow::payingUsers, RollupRow::qualityUsers, false),
    ARPU(RollupRow::totalRevenue, RollupRow::qualityUsers, true),
    CPA(RollupRow::totalCost, RollupRow::qualityUsers, true),
    FEMALE_RATIO(RollupRow::femaleUsers, RollupRow::qualityUsers, false),
    YOUNG_RATIO(RollupRow::youngUsers, RollupRow::qualityUsers, false),
    HIGH_TIER_RATIO(RollupRow::highTierUsers, RollupRow::qualityUsers, false);

    private static final double MINOR_PER_MAJOR = 100d;

    private final ToLongFunction<RollupRow> numerator;
    private final ToLongFunction<RollupRow> denominator;
    private final boolean monetary;

    Metric(ToLongFunction<RollupRow> numerator, ToLongFunction<RollupRow> denominator, boolean monetary) {
        this.numerator = numerator;
        this.denominator = denominator;
        this.monetary = monetary;
    }

    public Ratio valueOf(RollupRow row) {
        long num = numerator.applyAsLong(row);
        Ratio raw = denominator == null
                ? Ratio.of((double) num)
                : Ratios.safeRatio(num, denominator.applyAsLong(row));
        return monetary ? raw.map(value -> value / MINOR_PER_MAJOR) : raw;
    }

    /**
     * Same value as {@link #valueOf} computed in decimal arithmetic, for threshold decisions.
     */
    public Optional<BigDecimal> exactValueOf(RollupRow row) {
        long num = numerator.applyAsLong(row);
        Optional<BigDecimal> raw = denominator == null
                ? Optional.of(BigDecimal.valueOf(num))
                : Ratios.exactRatio(num, denominator.applyAsLong(row));
        return monetary ? raw.map(value -> value.movePointLeft(2)) : raw;
    }

    public long numeratorOf(RollupRow row) {
        return numerator.applyAsLong(row);
    }

    public long denominatorOf(RollupRow row) {
        return denominator == null ? 0L : denominator.applyAsLong(row);
    }

    public boolean isRatio() {
        return denominator != null;
    }

    /**
     * True when the numerator is money in minor units.
     */
    public boolean isMonetary() {
        return monetary;
    }
}
