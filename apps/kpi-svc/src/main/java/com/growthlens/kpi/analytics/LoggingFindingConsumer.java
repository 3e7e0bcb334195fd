package com.growthlens.kpi.analytics;

import com.growthlens.kpi.model.AnomalyFinding;
import com.growthlens.kpi.model.ContributionEntry;
import com.growthlens.kpi.model.KpiReport;
import com.growthlens.kpi.model.PerformanceScore;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingFindingConsumer implements FindingConsumer {

    private static final Logger log = LoggerFactory.getLogger(LoggingFindingConsumer.class);
    private static final int TOP_CONTRIBUTORS = 3;

    @Override
    public void accept(KpiReport report) {
        PerformanceScore performance = report.performance();
        log.info("KPI report {}: performance {} ({}/{})",
                report.date(), performance.grade(), performance.score(), performance.maxScore());
        if (report.rejections() != null && report.rejections().rejected() > 0) {
            log.warn("KPI report {}: {} fact rows rejected", report.date(), report.rejections().rejected());
        }
        if (!report.sanityIssues().isEmpty()) {
            log.warn("KPI report {}: {} rollup sanity issues", report.date(), report.sanityIssues().size());
        }
        if (report.findings().isEmpty()) {
            log.info("KPI report {}: status {}, no anomalies", report.date(), report.status());
            return;
        }
        log.warn("KPI report {}: status {}, {} anomalies", report.date(), report.status(), report.findings().size());
        for (KpiReport.AttributedFinding attributed : report.findings()) {
            AnomalyFinding finding = attributed.finding();
            log.warn("  [{}] {} {}:'{}' observed {} vs baseline {} ({}%) rule {}",
                    finding.severity(),
                    finding.metric(),
                    finding.granularity(),
                    finding.granularityKey(),
                    format(finding.observedValue()),
                    format(finding.baselineValue()),
                    finding.percentChange().isDefined() ? format(finding.percentChange().value()) : "n/a",
                    finding.triggeringRule().name());
            attributed.contributions().stream()
                    .limit(TOP_CONTRIBUTORS)
                    .forEach(entry -> log.warn("    #{} channel '{}' delta {} share {}",
                            entry.rank(), entry.channelKey(), entry.deltaContribution(), share(entry)));
        }
    }

    private static String share(ContributionEntry entry) {
        return entry.sharePercent().isDefined() ? format(entry.sharePercent().value()) + "%" : "n/a";
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
