package com.growthlens.kpi.analytics;

import com.growthlens.kpi.money.MinorUnits;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * @param maxFractionDigits fraction digits a money value may carry before it is rejected
 * @param platformFeeRates  per-OS share of gross revenue withheld by the store; used only
 *                          when a row carries no after-tax revenue
 */
public record NormalizerSettings(int maxFractionDigits, Map<String, BigDecimal> platformFeeRates) {

    public NormalizerSettings {
        if (maxFractionDigits < MinorUnits.MINOR_UNIT_SCALE) {
            throw new IllegalArgumentException("maxFractionDigits must be at least " + MinorUnits.MINOR_UNIT_SCALE);
        }
        platformFeeRates = platformFeeRates == null ? Map.of() : platformFeeRates.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        entry -> entry.getKey().trim().toLowerCase(Locale.ROOT),
                        entry -> validateRate(entry.getKey(), entry.getValue())));
    }

    public static NormalizerSettings defaults() {
        return new NormalizerSettings(MinorUnits.DEFAULT_MAX_FRACTION_DIGITS, Map.of(
                "android", new BigDecimal("0.006"),
                "ios", new BigDecimal("0.3144")));
    }

    public BigDecimal feeRateFor(String osType) {
        return platformFeeRates.getOrDefault(osType, BigDecimal.ZERO);
    }

    private static BigDecimal validateRate(String os, BigDecimal rate) {
        if (rate == null || rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("platform fee rate for " + os + " must be between 0 and 1");
        }
        return rate;
    }
}
