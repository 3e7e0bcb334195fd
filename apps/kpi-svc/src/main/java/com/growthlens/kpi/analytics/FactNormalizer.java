package com.growthlens.kpi.analytics;

import com.growthlens.kpi.error.FactValidationException;
import com.growthlens.kpi.error.PrecisionException;
import com.growthlens.kpi.model.FactRecord;
import com.growthlens.kpi.money.MinorUnits;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Turns one raw upstream row into a {@link FactRecord}. Rows that cannot be represented or break
 * an invariant are rejected with {@link FactValidationException} or {@link PrecisionException};
 * nothing is clamped.
 */
@Component
public class FactNormalizer {

    public static final String DATE = "dt";
    public static final String CHANNEL = "ad_channel";
    public static final String AGENT = "agent";
    public static final String ACCOUNT = "ad_account";
    public static final String SUB_CHANNEL = "subchannel";
    public static final String STATUS = "status";
    public static final String VERIFICATION = "verification_status";
    public static final String OS_TYPE = "os_type";
    public static final String GENDER = "gender";
    public static final String AGE_BAND = "age_group";
    public static final String CITY_TIER = "city_tier";
    public static final String NEW_USERS = "newuser";
    public static final String RETAINED_USERS = "is_returned_1_day";
    public static final String GROSS_REVENUE = "revenue";
    public static final String NET_REVENUE = "revenue_aftertax";
    public static final String CASH_COST = "cash_cost";

    public FactRecord normalize(Map<String, ?> raw, NormalizerSettings settings) {
        if (raw == null) {
            throw new FactValidationException("row", "must not be null");
        }
        LocalDate date = parseDate(raw.get(DATE));
        String osType = lowerDimension(raw, OS_TYPE);

        long newUsers = count(raw, NEW_USERS);
        long retainedUsers = count(raw, RETAINED_USERS);
        Object grossValue = raw.get(GROSS_REVENUE);
        Object netValue = raw.get(NET_REVENUE);
        long grossRevenue;
        long netRevenue;
        if (netValue == null && grossValue != null) {
            grossRevenue = money(GROSS_REVENUE, grossValue, settings);
            netRevenue = grossRevenue - MinorUnits.applyRate(grossRevenue, settings.feeRateFor(osType));
        } else if (grossValue == null && netValue != null) {
            netRevenue = money(NET_REVENUE, netValue, settings);
            grossRevenue = netRevenue;
        } else {
            grossRevenue = grossValue == null ? 0L : money(GROSS_REVENUE, grossValue, settings);
            netRevenue = netValue == null ? 0L : money(NET_REVENUE, netValue, settings);
        }
        Object costValue = raw.get(CASH_COST);
        long cashCost = costValue == null ? 0L : money(CASH_COST, costValue, settings);

        FactRecord fact = new FactRecord(
                date,
                dimension(raw, CHANNEL),
                dimension(raw, AGENT),
                dimension(raw, ACCOUNT),
                dimension(raw, SUB_CHANNEL),
                lowerDimension(raw, STATUS),
                lowerDimension(raw, VERIFICATION),
                osType,
                lowerDimension(raw, GENDER),
                dimension(raw, AGE_BAND),
                dimension(raw, CITY_TIER),
                newUsers,
                retainedUsers,
                grossRevenue,
                netRevenue,
                cashCost
        );
        validate(fact);
        return fact;
    }

    void validate(FactRecord fact) {
        requireNonNegative(NEW_USERS, fact.newUsers());
        requireNonNegative(RETAINED_USERS, fact.retainedUsers());
        requireNonNegative(GROSS_REVENUE, fact.grossRevenue());
        requireNonNegative(NET_REVENUE, fact.netRevenue());
        requireNonNegative(CASH_COST, fact.cashCost());
        if (fact.retainedUsers() > fact.newUsers()) {
            throw new FactValidationException(RETAINED_USERS,
                    "retainedUsers <= newUsers (" + fact.retainedUsers() + " > " + fact.newUsers() + ")");
        }
        if (fact.netRevenue() > fact.grossRevenue()) {
            throw new FactValidationException(NET_REVENUE,
                    "netRevenue <= grossRevenue (" + fact.netRevenue() + " > " + fact.grossRevenue() + ")");
        }
    }

    private static void requireNonNegative(String field, long value) {
        if (value < 0) {
            throw new FactValidationException(field, "non-negative (was " + value + ")");
        }
    }

    private static LocalDate parseDate(Object value) {
        if (value == null) {
            throw new FactValidationException(DATE, "required");
        }
        if (value instanceof LocalDate localDate) {
            return localDate;
        }
        if (value instanceof java.sql.Date sqlDate) {
            return sqlDate.toLocalDate();
        }
        try {
            return LocalDate.parse(value.toString().trim());
        } catch (DateTimeParseException ex) {
            throw new FactValidationException(DATE, "ISO date (was '" + value + "')");
        }
    }

    private static String dimension(Map<String, ?> raw, String field) {
        Object value = raw.get(field);
        return value == null ? "" : value.toString().trim();
    }

    private static String lowerDimension(Map<String, ?> raw, String field) {
        return dimension(raw, field).toLowerCase(Locale.ROOT);
    }

    private static long count(Map<String, ?> raw, String field) {
        Object value = raw.get(field);
        if (value == null) {
            return 0L;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        BigDecimal decimal = decimal(field, value);
        BigDecimal stripped = decimal.stripTrailingZeros();
        if (stripped.scale() > 0) {
            throw new FactValidationException(field, "integral count (was " + decimal + ")");
        }
        if (MinorUnits.integerDigits(stripped) > 19) {
            throw new FactValidationException(field, "count within range (was " + decimal + ")");
        }
        try {
            return stripped.longValueExact();
        } catch (ArithmeticException ex) {
            throw new FactValidationException(field, "count within range (was " + decimal + ")");
        }
    }

    private static long money(String field, Object value, NormalizerSettings settings) {
        try {
            if (value instanceof Double || value instanceof Float) {
                return MinorUnits.toMinorUnits(((Number) value).doubleValue(), settings.maxFractionDigits());
            }
            return MinorUnits.toMinorUnits(decimal(field, value), settings.maxFractionDigits());
        } catch (PrecisionException ex) {
            throw ex.forField(field);
        }
    }

    private static BigDecimal decimal(String field, Object value) {
        if (value instanceof BigDecimal bigDecimal) {
            return bigDecimal;
        }
        if (value instanceof BigInteger bigInteger) {
            return new BigDecimal(bigInteger);
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                throw new FactValidationException(field, "finite number (was " + number + ")");
            }
            return BigDecimal.valueOf(number);
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.longValue());
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException ex) {
            throw new FactValidationException(field, "numeric (was '" + value + "')");
        }
    }
}
