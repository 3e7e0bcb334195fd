package com.growthlens.kpi.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.growthlens.kpi.error.FactValidationException;
import com.growthlens.kpi.error.PrecisionException;
import com.growthlens.kpi.model.FactRecord;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class FactNormalizerTest {

    private final FactNormalizer normalizer = new FactNormalizer();
    private final NormalizerSettings settings = NormalizerSettings.defaults();

    @Test
    void normalizesDimensionsAndMoney() {
        Map<String, Object> raw = row();
        raw.put(FactNormalizer.CHANNEL, "  huawei ");
        raw.put(FactNormalizer.STATUS, "GOOD");
        raw.put(FactNormalizer.VERIFICATION, "Verified");
        raw.put(FactNormalizer.GROSS_REVENUE, new BigDecimal("812.50"));
        raw.put(FactNormalizer.NET_REVENUE, new BigDecimal("800.00"));
        raw.put(FactNormalizer.CASH_COST, "400");

        FactRecord fact = normalizer.normalize(raw, settings);

        assertThat(fact.date()).isEqualTo(LocalDate.of(2024, 5, 8));
        assertThat(fact.channel()).isEqualTo("huawei");
        assertThat(fact.status()).isEqualTo("good");
        assertThat(fact.verification()).isEqualTo("verified");
        assertThat(fact.grossRevenue()).isEqualTo(81_250L);
        assertThat(fact.netRevenue()).isEqualTo(80_000L);
        assertThat(fact.cashCost()).isEqualTo(40_000L);
        assertThat(fact.newUsers()).isEqualTo(10L);
    }

    @Test
    void whitespaceOnlyDimensionFallsIntoUnspecified() {
        Map<String, Object> raw = row();
        raw.put(FactNormalizer.CHANNEL, "   ");
        raw.put(FactNormalizer.AGENT, "\t");

        FactRecord fact = normalizer.normalize(raw, settings);

        assertThat(fact.channel()).isEmpty();
        assertThat(fact.agent()).isEmpty();
    }

    @Test
    void absentValuesBecomeZeroAndBlankDimensions() {
        Map<String, Object> raw = new HashMap<>();
        raw.put(FactNormalizer.DATE, "2024-05-08");

        FactRecord fact = normalizer.normalize(raw, settings);

        assertThat(fact.channel()).isEmpty();
        assertThat(fact.newUsers()).isZero();
        assertThat(fact.grossRevenue()).isZero();
        assertThat(fact.netRevenue()).isZero();
        assertThat(fact.cashCost()).isZero();
    }

    @Test
    void rejectsRetainedAboveNewUsersWithoutClamping() {
        Map<String, Object> raw = row();
        raw.put(FactNormalizer.NEW_USERS, 5);
        raw.put(FactNormalizer.RETAINED_USERS, 6);

        assertThatThrownBy(() -> normalizer.normalize(raw, settings))
                .isInstanceOf(FactValidationException.class)
                .satisfies(ex -> assertThat(((FactValidationException) ex).field()).isEqualTo(FactNormalizer.RETAINED_USERS));
    }

    @Test
    void rejectsNetAboveGross() {
        Map<String, Object> raw = row();
        raw.put(FactNormalizer.GROSS_REVENUE, "10.00");
        raw.put(FactNormalizer.NET_REVENUE, "10.01");

        assertThatThrownBy(() -> normalizer.normalize(raw, settings))
                .isInstanceOf(FactValidationException.class)
                .hasMessageContaining(FactNormalizer.NET_REVENUE);
    }

    @Test
    void rejectsNegativeCounts() {
        Map<String, Object> raw = row();
        raw.put(FactNormalizer.NEW_USERS, -1L);

        assertThatThrownBy(() -> normalizer.normalize(raw, settings))
                .isInstanceOf(FactValidationException.class)
                .hasMessageContaining("non-negative");
    }

    @Test
    void rejectsFractionalCounts() {
        Map<String, Object> raw = row();
        raw.put(FactNormalizer.NEW_USERS, new BigDecimal("2.5"));

        assertThatThrownBy(() -> normalizer.normalize(raw, settings))
                .isInstanceOf(FactValidationException.class)
                .hasMessageContaining("integral");
    }

    @Test
    void acceptsIntegralDecimalCounts() {
        Map<String, Object> raw = row();
        raw.put(FactNormalizer.NEW_USERS, new BigDecimal("12.000"));

        assertThat(normalizer.normalize(raw, settings).newUsers()).isEqualTo(12L);
    }

    @Test
    void overPreciseMoneyIsAPrecisionErrorScopedToTheField() {
        Map<String, Object> raw = row();
        raw.put(FactNormalizer.CASH_COST, new BigDecimal("1.1234567"));

        assertThatThrownBy(() -> normalizer.normalize(raw, settings))
                .isInstanceOf(PrecisionException.class)
                .satisfies(ex -> assertThat(((PrecisionException) ex).field()).isEqualTo(FactNormalizer.CASH_COST));
    }

    @Test
    @Timeout(value = 1, unit = TimeUnit.SECONDS)
    void hugeExponentStringsAreRejectedQuickly() {
        Map<String, Object> money = row();
        money.put(FactNormalizer.NET_REVENUE, "1E+50000000");
        Map<String, Object> count = row();
        count.put(FactNormalizer.NEW_USERS, "1E+2147483647");

        assertThatThrownBy(() -> normalizer.normalize(money, settings))
                .isInstanceOf(PrecisionException.class)
                .satisfies(ex -> assertThat(((PrecisionException) ex).field()).isEqualTo(FactNormalizer.NET_REVENUE));
        assertThatThrownBy(() -> normalizer.normalize(count, settings))
                .isInstanceOf(FactValidationException.class)
                .hasMessageContaining("count within range");
    }

    @Test
    void missingDateIsRejected() {
        Map<String, Object> raw = row();
        raw.remove(FactNormalizer.DATE);

        assertThatThrownBy(() -> normalizer.normalize(raw, settings))
                .isInstanceOf(FactValidationException.class)
                .hasMessageContaining(FactNormalizer.DATE);
    }

    @Test
    void derivesNetFromGrossUsingPlatformFee() {
        Map<String, Object> raw = row();
        raw.put(FactNormalizer.OS_TYPE, "iOS");
        raw.put(FactNormalizer.GROSS_REVENUE, new BigDecimal("100.00"));

        FactRecord fact = normalizer.normalize(raw, settings);

        assertThat(fact.grossRevenue()).isEqualTo(10_000L);
        assertThat(fact.netRevenue()).isEqualTo(10_000L - 3_144L);
    }

    @Test
    void unknownPlatformKeepsGrossAsNet() {
        Map<String, Object> raw = row();
        raw.put(FactNormalizer.OS_TYPE, "harmony");
        raw.put(FactNormalizer.GROSS_REVENUE, 50.0d);

        FactRecord fact = normalizer.normalize(raw, settings);

        assertThat(fact.netRevenue()).isEqualTo(fact.grossRevenue()).isEqualTo(5_000L);
    }

    @Test
    void netOnlyRowUsesNetAsGross() {
        Map<String, Object> raw = row();
        raw.put(FactNormalizer.NET_REVENUE, "20.00");

        FactRecord fact = normalizer.normalize(raw, settings);

        assertThat(fact.grossRevenue()).isEqualTo(2_000L);
        assertThat(fact.netRevenue()).isEqualTo(2_000L);
    }

    @Test
    void normalizingTwiceYieldsEqualRecords() {
        Map<String, Object> raw = row();
        raw.put(FactNormalizer.GROSS_REVENUE, 33.33d);

        assertThat(normalizer.normalize(raw, settings)).isEqualTo(normalizer.normalize(raw, settings));
    }

    private static Map<String, Object> row() {
        Map<String, Object> raw = new HashMap<>();
        raw.put(FactNormalizer.DATE, java.sql.Date.valueOf(LocalDate.of(2024, 5, 8)));
        raw.put(FactNormalizer.CHANNEL, "huawei");
        raw.put(FactNormalizer.STATUS, "good");
        raw.put(FactNormalizer.VERIFICATION, "verified");
        raw.put(FactNormalizer.NEW_USERS, 10);
        raw.put(FactNormalizer.RETAINED_USERS, 4);
        return raw;
    }
}
