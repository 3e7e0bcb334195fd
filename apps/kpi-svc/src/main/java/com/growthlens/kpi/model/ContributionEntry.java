package com.growthlens.kpi.model;

/**
 * One channel's share of a deviation. Deltas are in the metric's numerator/denominator units
 * (minor units for money).
 */
public record ContributionEntry(
        String channelKey,
        long deltaContribution,
        long denominatorDelta,
        Ratio sharePercent,
        int rank
) {
}
