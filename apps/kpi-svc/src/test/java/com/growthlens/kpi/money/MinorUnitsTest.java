package com.growthlens.kpi.money;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.growthlens.kpi.error.PrecisionException;
import java.math.BigDecimal;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class MinorUnitsTest {

    @Test
    void convertsMajorAmountsToCents() {
        assertThat(MinorUnits.toMinorUnits(new BigDecimal("800.00"))).isEqualTo(80_000L);
        assertThat(MinorUnits.toMinorUnits(new BigDecimal("0.01"))).isEqualTo(1L);
        assertThat(MinorUnits.toMinorUnits(new BigDecimal("12"))).isEqualTo(1_200L);
    }

    @Test
    void roundsHalfUpToWholeCents() {
        assertThat(MinorUnits.toMinorUnits(new BigDecimal("1.005"))).isEqualTo(101L);
        assertThat(MinorUnits.toMinorUnits(new BigDecimal("1.0049"))).isEqualTo(100L);
    }

    @Test
    void trailingZerosDoNotCountAsPrecision() {
        assertThat(MinorUnits.toMinorUnits(new BigDecimal("3.1000000000"), 6)).isEqualTo(310L);
    }

    @Test
    void rejectsAmountsWithTooManyFractionDigits() {
        assertThatThrownBy(() -> MinorUnits.toMinorUnits(new BigDecimal("1.0000001"), 6))
                .isInstanceOf(PrecisionException.class)
                .hasMessageContaining("fraction digits");
    }

    @Test
    void rejectsAmountsOutsideLongRange() {
        BigDecimal huge = new BigDecimal("1e17");

        assertThatThrownBy(() -> MinorUnits.toMinorUnits(huge))
                .isInstanceOf(PrecisionException.class)
                .hasMessageContaining("range");
    }

    @Test
    @Timeout(value = 1, unit = TimeUnit.SECONDS)
    void hugeExponentsAreRejectedWithoutExpansion() {
        assertThatThrownBy(() -> MinorUnits.toMinorUnits(new BigDecimal("1E+50000000")))
                .isInstanceOf(PrecisionException.class)
                .hasMessageContaining("range");
        assertThatThrownBy(() -> MinorUnits.toMinorUnits(new BigDecimal("-4E+999999999")))
                .isInstanceOf(PrecisionException.class);
        assertThatThrownBy(() -> MinorUnits.toMinorUnits(new BigDecimal("1E-50000000")))
                .isInstanceOf(PrecisionException.class)
                .hasMessageContaining("fraction digits");
    }

    @Test
    void largestRepresentableAmountStillConverts() {
        assertThat(MinorUnits.toMinorUnits(new BigDecimal("92233720368547758.07"))).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void doubleNoiseIsAbsorbed() {
        assertThat(MinorUnits.toMinorUnits(0.1 + 0.2, 6)).isEqualTo(30L);
        assertThat(MinorUnits.toMinorUnits(19.99, 2)).isEqualTo(1_999L);
    }

    @Test
    void rejectsNonFiniteDoubles() {
        assertThatThrownBy(() -> MinorUnits.toMinorUnits(Double.NaN, 6)).isInstanceOf(PrecisionException.class);
        assertThatThrownBy(() -> MinorUnits.toMinorUnits(Double.POSITIVE_INFINITY, 6)).isInstanceOf(PrecisionException.class);
    }

    @Test
    void appliesRateWithHalfUpRounding() {
        assertThat(MinorUnits.applyRate(10_000L, new BigDecimal("0.3144"))).isEqualTo(3_144L);
        assertThat(MinorUnits.applyRate(250L, new BigDecimal("0.006"))).isEqualTo(2L);
    }

    @Test
    void majorUnitsKeepTwoDecimals() {
        assertThat(MinorUnits.toMajorUnits(100_000L)).isEqualByComparingTo("1000.00");
        assertThat(MinorUnits.toMajorUnits(5L).toPlainString()).isEqualTo("0.05");
    }
}
