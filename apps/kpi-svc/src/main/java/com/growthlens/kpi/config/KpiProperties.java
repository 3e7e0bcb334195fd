package com.growthlens.kpi.config;

import com.growthlens.kpi.analytics.BaselineSelector;
import com.growthlens.kpi.analytics.MetricRange;
import com.growthlens.kpi.analytics.NormalizerSettings;
import com.growthlens.kpi.analytics.PopulationRules;
import com.growthlens.kpi.model.AnomalyRule;
import com.growthlens.kpi.model.Direction;
import com.growthlens.kpi.model.Granularity;
import com.growthlens.kpi.model.Metric;
import com.growthlens.kpi.model.Severity;
import com.growthlens.kpi.model.ThresholdKind;
import com.growthlens.kpi.money.MinorUnits;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "kpi")
public record KpiProperties(
        Baseline baseline,
        Detection detection,
        Rollup rollup,
        Normalizer normalizer,
        Sanity sanity,
        Facts facts,
        List<Rule> rules
) {

    @ConstructorBinding
    public KpiProperties {
        baseline = baseline != null ? baseline : new Baseline(null);
        detection = detection != null ? detection : new Detection(null, null);
        rollup = rollup != null ? rollup : new Rollup(null, null);
        normalizer = normalizer != null ? normalizer : new Normalizer(null, null);
        sanity = sanity != null ? sanity : new Sanity(null);
        facts = facts != null ? facts : new Facts(null);
        rules = rules == null ? List.of() : List.copyOf(rules);
        if (!rollup.granularities().contains(Granularity.CHANNEL)) {
            // contributions are always ranked over channel rollups
            throw new IllegalArgumentException("rollup granularities must include CHANNEL");
        }
    }

    public List<AnomalyRule> anomalyRules() {
        return rules.stream().map(Rule::toAnomalyRule).toList();
    }

    public record Baseline(Integer windowDays) {
        public Baseline {
            if (windowDays == null) {
                windowDays = BaselineSelector.DEFAULT_WINDOW_DAYS;
            }
            if (windowDays <= 0) {
                throw new IllegalArgumentException("windowDays must be positive");
            }
        }
    }

    public record Detection(Boolean includeChannelRows, Double trendThresholdPercent) {
        public Detection {
            includeChannelRows = includeChannelRows != null && includeChannelRows;
            if (trendThresholdPercent == null) {
                trendThresholdPercent = 5.0d;
            }
            if (trendThresholdPercent < 0) {
                throw new IllegalArgumentException("trendThresholdPercent must not be negative");
            }
        }
    }

    public record Rollup(List<Granularity> granularities, Population population) {
        public Rollup {
            granularities = granularities == null || granularities.isEmpty()
                    ? List.of(Granularity.GLOBAL, Granularity.CHANNEL, Granularity.OS_TYPE)
                    : List.copyOf(granularities);
            population = population != null ? population : new Population(null, null, null, null, null);
        }

        public Set<Granularity> granularitySet() {
            return EnumSet.copyOf(granularities);
        }
    }

    public record Population(String goodStatus,
                             String verifiedStatus,
                             String femaleGender,
                             Set<String> youngAgeBands,
                             Set<String> highCityTiers) {

        public PopulationRules toRules() {
            PopulationRules defaults = PopulationRules.defaults();
            return new PopulationRules(
                    goodStatus != null ? goodStatus : defaults.goodStatus(),
                    verifiedStatus != null ? verifiedStatus : defaults.verifiedStatus(),
                    femaleGender != null ? femaleGender : defaults.femaleGender(),
                    youngAgeBands != null ? youngAgeBands : defaults.youngAgeBands(),
                    highCityTiers != null ? highCityTiers : defaults.highCityTiers()
            );
        }
    }

    public record Normalizer(Integer maxFractionDigits, Map<String, BigDecimal> platformFeeRates) {

        public NormalizerSettings toSettings() {
            NormalizerSettings defaults = NormalizerSettings.defaults();
            return new NormalizerSettings(
                    maxFractionDigits != null ? maxFractionDigits : MinorUnits.DEFAULT_MAX_FRACTION_DIGITS,
                    platformFeeRates != null ? platformFeeRates : defaults.platformFeeRates()
            );
        }
    }

    public record Sanity(Map<Metric, MetricRange> ranges) {
        public Sanity {
            ranges = ranges == null || ranges.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(ranges));
        }
    }

    public record Facts(String table) {
        public Facts {
            if (table == null || table.isBlank()) {
                table = "newuser_channel_facts";
            }
            if (!table.matches("[A-Za-z_][A-Za-z0-9_.]*")) {
                throw new IllegalArgumentException("facts table must be a plain identifier");
            }
        }
    }

    public record Rule(String name,
                       Metric metric,
                       ThresholdKind thresholdKind,
                       Double thresholdValue,
                       Direction direction,
                       Severity severity,
                       Integer minBaselineDays) {

        public Rule {
            if (metric == null) {
                throw new IllegalArgumentException("rule metric must be provided");
            }
            if (thresholdValue == null) {
                throw new IllegalArgumentException("rule thresholdValue must be provided");
            }
        }

        public AnomalyRule toAnomalyRule() {
            return new AnomalyRule(
                    name,
                    metric,
                    thresholdKind != null ? thresholdKind : ThresholdKind.PERCENTAGE,
                    thresholdValue,
                    direction != null ? direction : Direction.EITHER,
                    severity != null ? severity : Severity.MEDIUM,
                    minBaselineDays != null ? minBaselineDays : 1
            );
        }
    }
}
