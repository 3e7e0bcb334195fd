package com.growthlens.kpi.model;

import java.util.List;

/**
 * Points earned by the global row against fixed KPI tiers, graded A to D.
 */
public record PerformanceScore(int score, int maxScore, Grade grade, List<ScoreItem> items) {

    public PerformanceScore {
        if (grade == null) {
            throw new IllegalArgumentException("grade must be provided");
        }
        items = List.copyOf(items);
    }

    public enum Grade {
        A(80),
        B(60),
        C(40),
        D(0);

        private final int minPercent;

        Grade(int minPercent) {
            this.minPercent = minPercent;
        }

        public static Grade forPercent(double percent) {
            for (Grade grade : values()) {
                if (percent >= grade.minPercent) {
                    return grade;
                }
            }
            return D;
        }
    }

    /**
     * {@code value} is undefined when the metric has a zero denominator; such a component earns
     * no points.
     */
    public record ScoreItem(Metric metric, Ratio value, int points, int maxPoints) {
    }
}
