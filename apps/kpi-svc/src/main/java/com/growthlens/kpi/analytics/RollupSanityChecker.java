package com.growthlens.kpi.analytics;

import com.growthlens.kpi.model.Metric;
import com.growthlens.kpi.model.Ratio;
import com.growthlens.kpi.model.RollupRow;
import com.growthlens.kpi.model.SanityIssue;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Plausibility checks on computed rollups. Issues are reported, rows are never altered.
 */
@Component
public class RollupSanityChecker {

    private static final Logger log = LoggerFactory.getLogger(RollupSanityChecker.class);

    public List<SanityIssue> check(List<RollupRow> rows, Map<Metric, MetricRange> ranges) {
        List<SanityIssue> issues = new ArrayList<>();
        for (RollupRow row : rows) {
            logic(issues, row, "quality_within_good", row.qualityUsers() <= row.goodUsers(),
                    "qualityUsers " + row.qualityUsers() + " exceeds goodUsers " + row.goodUsers());
            logic(issues, row, "quality_within_verified", row.qualityUsers() <= row.verifiedUsers(),
                    "qualityUsers " + row.qualityUsers() + " exceeds verifiedUsers " + row.verifiedUsers());
            logic(issues, row, "paying_within_quality", row.payingUsers() <= row.qualityUsers(),
                    "payingUsers " + row.payingUsers() + " exceeds qualityUsers " + row.qualityUsers());
            logic(issues, row, "retained_within_quality", row.retainedUsers() <= row.qualityUsers(),
                    "retainedUsers " + row.retainedUsers() + " exceeds qualityUsers " + row.qualityUsers());
            if (row.isGlobal()) {
                ranges.forEach((metric, range) -> checkRange(issues, row, metric, range));
            }
        }
        for (SanityIssue issue : issues) {
            log.warn("Rollup sanity {} on {} [{}:'{}'] {}: {}", issue.level(), rows.get(0).date(),
                    issue.granularity(), issue.granularityKey(), issue.check(), issue.message());
        }
        return issues;
    }

    private static void logic(List<SanityIssue> issues, RollupRow row, String check, boolean holds, String message) {
        if (!holds) {
            issues.add(new SanityIssue(SanityIssue.Level.ERROR, row.granularity(), row.granularityKey(), check, message));
        }
    }

    private static void checkRange(List<SanityIssue> issues, RollupRow row, Metric metric, MetricRange range) {
        Ratio value = metric.valueOf(row);
        if (value.isDefined() && !range.contains(value.value())) {
            issues.add(new SanityIssue(SanityIssue.Level.WARNING, row.granularity(), row.granularityKey(),
                    metric.name().toLowerCase(Locale.ROOT) + "_range",
                    metric + " " + value.value() + " outside [" + range.min() + ", " + range.max() + "]"));
        }
    }
}
