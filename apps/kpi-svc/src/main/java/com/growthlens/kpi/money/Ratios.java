package com.growthlens.kpi.money;

import com.growthlens.kpi.model.Ratio;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Optional;

public final class Ratios {

    /**
     * Precision for ratio and percent-change arithmetic that feeds threshold comparisons. Inputs
     * are integer sums, so terminating quotients such as 115/100 stay exact.
     */
    public static final MathContext DECISION_CONTEXT = MathContext.DECIMAL128;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Ratios() {
    }

    public static Ratio safeRatio(long numerator, long denominator) {
        if (denominator == 0) {
            return Ratio.undefined();
        }
        return Ratio.of((double) numerator / (double) denominator);
    }

    public static Optional<BigDecimal> exactRatio(long numerator, long denominator) {
        if (denominator == 0) {
            return Optional.empty();
        }
        return Optional.of(BigDecimal.valueOf(numerator).divide(BigDecimal.valueOf(denominator), DECISION_CONTEXT));
    }

    public static Optional<BigDecimal> percentChange(BigDecimal current, BigDecimal baseline) {
        if (baseline.signum() == 0) {
            return Optional.empty();
        }
        return Optional.of(current.subtract(baseline).multiply(HUNDRED).divide(baseline, DECISION_CONTEXT));
    }

    public static BigDecimal mean(List<BigDecimal> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("mean of no values");
        }
        BigDecimal total = values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return total.divide(BigDecimal.valueOf(values.size()), DECISION_CONTEXT);
    }

    public static Ratio toRatio(Optional<BigDecimal> value) {
        return value.map(decimal -> Ratio.of(decimal.doubleValue())).orElse(Ratio.undefined());
    }
}
