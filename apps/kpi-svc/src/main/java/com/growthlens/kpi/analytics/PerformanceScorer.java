package com.growthlens.kpi.analytics;

import com.growthlens.kpi.model.Metric;
import com.growthlens.kpi.model.PerformanceScore;
import com.growthlens.kpi.model.RollupRow;
import com.growthlens.kpi.money.Ratios;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Grades a rollup row on ARPU, retention, conversion and quality rate. Tier floors are inclusive;
 * ARPU floors are major units, rate floors are fractions.
 */
@Component
public class PerformanceScorer {

    private static final List<Criterion> CRITERIA = List.of(
            new Criterion(Metric.ARPU, 30, List.of(tier("10", 30), tier("5", 20), tier("2", 10))),
            new Criterion(Metric.RETENTION_RATE, 30, List.of(tier("0.60", 30), tier("0.40", 20), tier("0.20", 10))),
            new Criterion(Metric.CONVERSION_RATE, 25, List.of(tier("0.40", 25), tier("0.25", 20), tier("0.10", 10))),
            new Criterion(Metric.QUALITY_RATE, 15, List.of(tier("0.50", 15), tier("0.30", 10), tier("0.15", 5)))
    );

    public PerformanceScore score(RollupRow row) {
        int score = 0;
        int maxScore = 0;
        List<PerformanceScore.ScoreItem> items = new ArrayList<>(CRITERIA.size());
        for (Criterion criterion : CRITERIA) {
            Optional<BigDecimal> value = criterion.metric().exactValueOf(row);
            int points = value.map(criterion::pointsFor).orElse(0);
            score += points;
            maxScore += criterion.maxPoints();
            items.add(new PerformanceScore.ScoreItem(
                    criterion.metric(), Ratios.toRatio(value), points, criterion.maxPoints()));
        }
        double percent = score * 100d / maxScore;
        return new PerformanceScore(score, maxScore, PerformanceScore.Grade.forPercent(percent), items);
    }

    private static Tier tier(String floor, int points) {
        return new Tier(new BigDecimal(floor), points);
    }

    private record Tier(BigDecimal floor, int points) {
    }

    // tiers are ordered from the highest floor down
    private record Criterion(Metric metric, int maxPoints, List<Tier> tiers) {

        int pointsFor(BigDecimal value) {
            for (Tier tier : tiers) {
                if (value.compareTo(tier.floor()) >= 0) {
                    return tier.points();
                }
            }
            return 0;
        }
    }
}
