package com.growthlens.kpi.analytics;

import com.growthlens.kpi.model.AnomalyFinding;
import com.growthlens.kpi.model.AnomalyRule;
import com.growthlens.kpi.model.BaselineWindow;
import com.growthlens.kpi.model.DetectionResult;
import com.growthlens.kpi.model.Metric;
import com.growthlens.kpi.model.RollupRow;
import com.growthlens.kpi.model.RuleSkip;
import com.growthlens.kpi.model.ThresholdKind;
import com.growthlens.kpi.money.Ratios;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Compares a rollup row with the mean of its baseline window under a rule set. Pure: no I/O and
 * no state, so rows may be evaluated in any order or in parallel. Threshold decisions use decimal
 * arithmetic over the integer sums; the finding carries the same values as doubles.
 */
@Component
public class AnomalyDetectionService {

    private static final Comparator<Candidate> STRONGEST_RULE = Comparator
            .comparing((Candidate candidate) -> candidate.rule().severity())
            .thenComparingDouble(candidate -> Math.abs(candidate.rule().thresholdValue()))
            // earlier declaration wins the final tie
            .thenComparing(Candidate::order, Comparator.reverseOrder());

    public DetectionResult detect(RollupRow row, BaselineWindow baseline, List<AnomalyRule> rules) {
        if (!row.granularity().equals(baseline.granularity()) || !row.granularityKey().equals(baseline.granularityKey())) {
            throw new IllegalArgumentException("baseline window belongs to a different key than the row");
        }
        Map<Metric, List<Candidate>> rulesByMetric = new LinkedHashMap<>();
        for (int i = 0; i < rules.size(); i++) {
            AnomalyRule rule = rules.get(i);
            rulesByMetric.computeIfAbsent(rule.metric(), metric -> new ArrayList<>()).add(new Candidate(rule, i));
        }

        List<AnomalyFinding> findings = new ArrayList<>();
        List<RuleSkip> skipped = new ArrayList<>();
        rulesByMetric.forEach((metric, candidates) ->
                evaluateMetric(row, baseline, metric, candidates, skipped).ifPresent(findings::add));
        return new DetectionResult(findings, skipped);
    }

    private Optional<AnomalyFinding> evaluateMetric(RollupRow row,
                                                    BaselineWindow baseline,
                                                    Metric metric,
                                                    List<Candidate> candidates,
                                                    List<RuleSkip> skipped) {
        Optional<BigDecimal> observed = metric.exactValueOf(row);
        List<BigDecimal> history = baseline.definedValues(metric);
        int validDays = history.size();

        List<Candidate> active = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (validDays < candidate.rule().minBaselineDays() || validDays == 0) {
                skipped.add(new RuleSkip(candidate.rule(), row.granularity(), row.granularityKey(), validDays));
            } else {
                active.add(candidate);
            }
        }
        if (active.isEmpty() || observed.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal mean = Ratios.mean(history);
        BigDecimal current = observed.get();
        Optional<BigDecimal> percentChange = Ratios.percentChange(current, mean);
        BigDecimal absoluteChange = current.subtract(mean);

        return active.stream()
                .filter(candidate -> triggers(candidate.rule(), percentChange, absoluteChange))
                .max(STRONGEST_RULE)
                .map(candidate -> new AnomalyFinding(
                        row.date(),
                        row.granularity(),
                        row.granularityKey(),
                        metric,
                        current.doubleValue(),
                        mean.doubleValue(),
                        Ratios.toRatio(percentChange),
                        absoluteChange.doubleValue(),
                        validDays,
                        candidate.rule().severity(),
                        candidate.rule()
                ));
    }

    private boolean triggers(AnomalyRule rule, Optional<BigDecimal> percentChange, BigDecimal absoluteChange) {
        BigDecimal threshold = BigDecimal.valueOf(rule.thresholdValue());
        if (rule.thresholdKind() == ThresholdKind.PERCENTAGE) {
            return percentChange
                    .map(change -> rule.direction().triggers(change, threshold))
                    .orElse(false);
        }
        return rule.direction().triggers(absoluteChange, threshold);
    }

    private record Candidate(AnomalyRule rule, int order) {
    }
}
