package com.growthlens.kpi.money;

import com.growthlens.kpi.error.PrecisionException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Fixed-point money: amounts are stored and summed as {@code long} cents.
 */
public final class MinorUnits {

    public static final int MINOR_UNIT_SCALE = 2;
    public static final int DEFAULT_MAX_FRACTION_DIGITS = 6;

    private static final int MAX_MAJOR_INTEGER_DIGITS = 19 - MINOR_UNIT_SCALE;
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);
    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final MathContext DOUBLE_SIGNIFICANT_DIGITS = new MathContext(15, RoundingMode.HALF_EVEN);

    private MinorUnits() {
    }

    public static long toMinorUnits(BigDecimal amount) {
        return toMinorUnits(amount, DEFAULT_MAX_FRACTION_DIGITS);
    }

    public static long toMinorUnits(BigDecimal amount, int maxFractionDigits) {
        if (amount == null) {
            throw new PrecisionException("amount must not be null");
        }
        BigDecimal stripped = amount.stripTrailingZeros();
        if (stripped.scale() > maxFractionDigits) {
            throw new PrecisionException("amount " + amount + " has "
                    + stripped.scale() + " fraction digits, at most " + maxFractionDigits + " allowed");
        }
        // checked before rescaling so a huge exponent is never expanded
        if (stripped.signum() != 0 && integerDigits(stripped) > MAX_MAJOR_INTEGER_DIGITS) {
            throw new PrecisionException("amount " + stripped + " exceeds the minor unit range");
        }
        BigDecimal minor = amount.setScale(MINOR_UNIT_SCALE, RoundingMode.HALF_UP).movePointRight(MINOR_UNIT_SCALE);
        if (minor.compareTo(LONG_MAX) > 0 || minor.compareTo(LONG_MIN) < 0) {
            throw new PrecisionException("amount " + amount + " exceeds the minor unit range");
        }
        return minor.longValueExact();
    }

    /**
     * Digits left of the decimal point, computed in {@code long} so extreme exponents do not wrap.
     */
    public static long integerDigits(BigDecimal value) {
        return (long) value.precision() - value.scale();
    }

    /**
     * Doubles are reduced to 15 significant digits first so binary noise such as
     * {@code 0.30000000000000004} does not count as extra precision.
     */
    public static long toMinorUnits(double amount, int maxFractionDigits) {
        if (Double.isNaN(amount) || Double.isInfinite(amount)) {
            throw new PrecisionException("amount must be finite: " + amount);
        }
        BigDecimal decimal = new BigDecimal(amount).round(DOUBLE_SIGNIFICANT_DIGITS);
        return toMinorUnits(decimal, maxFractionDigits);
    }

    public static BigDecimal toMajorUnits(long minorUnits) {
        return BigDecimal.valueOf(minorUnits, MINOR_UNIT_SCALE);
    }

    /**
     * Applies a fractional rate to a minor-unit amount, rounding half-up to a whole minor unit.
     */
    public static long applyRate(long minorUnits, BigDecimal rate) {
        return BigDecimal.valueOf(minorUnits)
                .multiply(rate)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
    }
}
