package com.growthlens.kpi.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.DoubleUnaryOperator;

/**
 * A ratio that is either a finite value or explicitly undefined (zero denominator).
 * Undefined is never represented as 0 or NaN.
 */
public final class Ratio {

    private static final Ratio UNDEFINED = new Ratio(false, 0d);

    private final boolean defined;
    private final double value;

    private Ratio(boolean defined, double value) {
        this.defined = defined;
        this.value = value;
    }

    public static Ratio of(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("ratio value must be finite: " + value);
        }
        return new Ratio(true, value);
    }

    public static Ratio undefined() {
        return UNDEFINED;
    }

    public boolean isDefined() {
        return defined;
    }

    public double value() {
        if (!defined) {
            throw new IllegalStateException("ratio is undefined");
        }
        return value;
    }

    public OptionalDouble asOptional() {
        return defined ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    public Ratio map(DoubleUnaryOperator operator) {
        return defined ? Ratio.of(operator.applyAsDouble(value)) : UNDEFINED;
    }

    /**
     * Presentation helper; returns {@code null} for undefined so JSON renders an explicit null.
     */
    public BigDecimal toDecimal(int scale) {
        return defined ? BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP) : null;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Ratio ratio)) {
            return false;
        }
        return defined == ratio.defined && Double.compare(value, ratio.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(defined, value);
    }

    @Override
    public String toString() {
        return defined ? Double.toString(value) : "undefined";
    }
}
