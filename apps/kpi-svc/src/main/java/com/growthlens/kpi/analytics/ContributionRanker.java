package com.growthlens.kpi.analytics;

import com.growthlens.kpi.model.AnomalyFinding;
import com.growthlens.kpi.model.ContributionEntry;
import com.growthlens.kpi.model.Granularity;
import com.growthlens.kpi.model.Metric;
import com.growthlens.kpi.model.Ratio;
import com.growthlens.kpi.model.RollupRow;
import com.growthlens.kpi.money.Ratios;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.ToLongFunction;
import org.springframework.stereotype.Component;

/**
 * Attributes a global finding to channels by how far each channel's numerator moved from its
 * baseline mean. Works on numerator/denominator sums, never on ratios.
 */
@Component
public class ContributionRanker {

    private static final Comparator<ContributionEntry> BY_MAGNITUDE = Comparator
            .comparingLong((ContributionEntry entry) -> Math.abs(entry.deltaContribution()))
            .reversed()
            .thenComparing(ContributionEntry::channelKey);

    /**
     * @param targetRows   channel rows of the finding's date
     * @param baselineRows channel rows of each date in the global baseline window, one list per
     *                     date; a channel missing on a date counts as zero for that date
     */
    public List<ContributionEntry> rank(AnomalyFinding finding,
                                        List<RollupRow> targetRows,
                                        List<List<RollupRow>> baselineRows) {
        if (finding.granularity() != Granularity.GLOBAL) {
            throw new IllegalArgumentException("contributions are ranked for global findings only");
        }
        Metric metric = finding.metric();
        Map<String, RollupRow> target = index(targetRows);
        TreeSet<String> channels = new TreeSet<>(target.keySet());
        baselineRows.forEach(rows -> rows.forEach(row -> channels.add(row.granularityKey())));

        List<ContributionEntry> unranked = new ArrayList<>();
        long totalMagnitude = 0;
        for (String channel : channels) {
            RollupRow current = target.get(channel);
            long numeratorNow = current == null ? 0L : metric.numeratorOf(current);
            long denominatorNow = current == null ? 0L : metric.denominatorOf(current);
            long numeratorDelta = numeratorNow - baselineMean(channel, baselineRows, metric::numeratorOf);
            long denominatorDelta = metric.isRatio()
                    ? denominatorNow - baselineMean(channel, baselineRows, metric::denominatorOf)
                    : 0L;
            totalMagnitude = Math.addExact(totalMagnitude, Math.abs(numeratorDelta));
            unranked.add(new ContributionEntry(channel, numeratorDelta, denominatorDelta, Ratio.undefined(), 0));
        }

        long denominator = totalMagnitude;
        List<ContributionEntry> sorted = unranked.stream().sorted(BY_MAGNITUDE).toList();
        List<ContributionEntry> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ContributionEntry entry = sorted.get(i);
            Ratio share = Ratios.safeRatio(entry.deltaContribution(), denominator).map(value -> value * 100d);
            ranked.add(new ContributionEntry(entry.channelKey(), entry.deltaContribution(), entry.denominatorDelta(), share, i + 1));
        }
        return ranked;
    }

    /**
     * Global numerator deviation on the same terms as the channel contributions: target minus the
     * rounded mean over the baseline dates.
     */
    public long globalDeviation(Metric metric, RollupRow globalTarget, List<RollupRow> globalBaseline) {
        long total = 0;
        for (RollupRow row : globalBaseline) {
            total = Math.addExact(total, metric.numeratorOf(row));
        }
        return metric.numeratorOf(globalTarget) - roundedMean(total, globalBaseline.size());
    }

    private static long baselineMean(String channel, List<List<RollupRow>> baselineRows, ToLongFunction<RollupRow> value) {
        long total = 0;
        for (List<RollupRow> rows : baselineRows) {
            for (RollupRow row : rows) {
                if (row.granularityKey().equals(channel)) {
                    total = Math.addExact(total, value.applyAsLong(row));
                }
            }
        }
        return roundedMean(total, baselineRows.size());
    }

    private static long roundedMean(long total, int days) {
        if (days == 0) {
            return 0L;
        }
        return BigDecimal.valueOf(total)
                .divide(BigDecimal.valueOf(days), 0, RoundingMode.HALF_UP)
                .longValueExact();
    }

    private static Map<String, RollupRow> index(List<RollupRow> rows) {
        Map<String, RollupRow> byKey = new TreeMap<>();
        for (RollupRow row : rows) {
            if (byKey.put(row.granularityKey(), row) != null) {
                throw new IllegalArgumentException("duplicate channel row for key '" + row.granularityKey() + "'");
            }
        }
        return byKey;
    }
}
