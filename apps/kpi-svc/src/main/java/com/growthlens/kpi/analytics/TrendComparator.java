package com.growthlens.kpi.analytics;

import com.growthlens.kpi.model.Metric;
import com.growthlens.kpi.model.MetricComparison;
import com.growthlens.kpi.model.Ratio;
import com.growthlens.kpi.model.RollupRow;
import com.growthlens.kpi.money.Ratios;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class TrendComparator {

    public List<MetricComparison> compare(RollupRow current,
                                          Optional<RollupRow> previous,
                                          Collection<Metric> metrics,
                                          double significancePercent) {
        BigDecimal threshold = BigDecimal.valueOf(significancePercent);
        return metrics.stream()
                .distinct()
                .map(metric -> {
                    Ratio now = metric.valueOf(current);
                    Ratio before = previous.map(metric::valueOf).orElse(Ratio.undefined());
                    Optional<BigDecimal> exactNow = metric.exactValueOf(current);
                    Optional<BigDecimal> exactBefore = previous.flatMap(metric::exactValueOf);
                    Optional<BigDecimal> change = exactNow.isPresent() && exactBefore.isPresent()
                            ? Ratios.percentChange(exactNow.get(), exactBefore.get())
                            : Optional.empty();
                    boolean significant = change
                            .map(value -> value.abs().compareTo(threshold) >= 0)
                            .orElse(false);
                    return new MetricComparison(metric, now, before, Ratios.toRatio(change), significant);
                })
                .toList();
    }
}
