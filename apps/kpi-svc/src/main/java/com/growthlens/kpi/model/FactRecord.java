package com.growthlens.kpi.model;

import java.time.LocalDate;

/**
 * One normalized observation. Dimension values are never null; an empty string is the
 * "unspecified" category. Money fields are minor units.
 */
public record FactRecord(
        LocalDate date,
        String channel,
        String agent,
        String account,
        String subChannel,
        String status,
        String verification,
        String osType,
        String gender,
        String ageBand,
        String cityTier,
        long newUsers,
        long retainedUsers,
        long grossRevenue,
        long netRevenue,
        long cashCost
) {
}
