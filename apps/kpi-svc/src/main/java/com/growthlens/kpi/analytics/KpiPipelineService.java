package com.growthlens.kpi.analytics;

import com.growthlens.kpi.config.KpiProperties;
import com.growthlens.kpi.config.RuleSource;
import com.growthlens.kpi.error.FactValidationException;
import com.growthlens.kpi.error.InconsistentRollupException;
import com.growthlens.kpi.error.KpiException;
import com.growthlens.kpi.error.PrecisionException;
import com.growthlens.kpi.error.RollupNotFoundException;
import com.growthlens.kpi.model.AnomalyFinding;
import com.growthlens.kpi.model.AnomalyRule;
import com.growthlens.kpi.model.BaselineWindow;
import com.growthlens.kpi.model.ContributionEntry;
import com.growthlens.kpi.model.DetectionResult;
import com.growthlens.kpi.model.DetectionStatus;
import com.growthlens.kpi.model.FactRecord;
import com.growthlens.kpi.model.Granularity;
import com.growthlens.kpi.model.KpiReport;
import com.growthlens.kpi.model.Metric;
import com.growthlens.kpi.model.MetricComparison;
import com.growthlens.kpi.model.RejectionSummary;
import com.growthlens.kpi.model.RollupBatch;
import com.growthlens.kpi.model.RollupRow;
import com.growthlens.kpi.model.RuleSkip;
import com.growthlens.kpi.model.SanityIssue;
import com.growthlens.kpi.repository.FactSource;
import com.growthlens.kpi.repository.RollupStore;
import com.growthlens.kpi.tracing.TraceContext;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the daily flow: fetch, normalize, roll up, persist, then detect and attribute.
 * Configuration is read once per call from {@link KpiProperties} and handed to each step.
 */
@Service
public class KpiPipelineService {

    private static final Logger log = LoggerFactory.getLogger(KpiPipelineService.class);

    static final int MAX_REJECTION_EXAMPLES = 5;
    static final int MAX_BACKFILL_DAYS = 366;

    public record RunResult(RollupBatch batch, KpiReport report) {
    }

    public record BackfillResult(List<LocalDate> completed, Map<LocalDate, String> failed) {

        public BackfillResult {
            completed = List.copyOf(completed);
            failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
        }
    }

    private final FactSource factSource;
    private final RollupStore rollupStore;
    private final RuleSource ruleSource;
    private final KpiProperties properties;
    private final FactNormalizer factNormalizer;
    private final RollupEngine rollupEngine;
    private final RollupSanityChecker sanityChecker;
    private final BaselineSelector baselineSelector;
    private final AnomalyDetectionService anomalyDetectionService;
    private final ContributionRanker contributionRanker;
    private final TrendComparator trendComparator;
    private final PerformanceScorer performanceScorer;
    private final List<FindingConsumer> findingConsumers;

    public KpiPipelineService(
            FactSource factSource,
            RollupStore rollupStore,
            RuleSource ruleSource,
            KpiProperties properties,
            FactNormalizer factNormalizer,
            RollupEngine rollupEngine,
            RollupSanityChecker sanityChecker,
            BaselineSelector baselineSelector,
            AnomalyDetectionService anomalyDetectionService,
            ContributionRanker contributionRanker,
            TrendComparator trendComparator,
            PerformanceScorer performanceScorer,
            List<FindingConsumer> findingConsumers
    ) {
        this.factSource = factSource;
        this.rollupStore = rollupStore;
        this.ruleSource = ruleSource;
        this.properties = properties;
        this.factNormalizer = factNormalizer;
        this.rollupEngine = rollupEngine;
        this.sanityChecker = sanityChecker;
        this.baselineSelector = baselineSelector;
        this.anomalyDetectionService = anomalyDetectionService;
        this.contributionRanker = contributionRanker;
        this.trendComparator = trendComparator;
        this.performanceScorer = performanceScorer;
        this.findingConsumers = List.copyOf(findingConsumers);
    }

    public RollupBatch refreshRollups(LocalDate date) {
        List<Map<String, Object>> raw = factSource.fetchFacts(date);
        NormalizerSettings settings = properties.normalizer().toSettings();

        List<FactRecord> facts = new ArrayList<>(raw.size());
        List<String> examples = new ArrayList<>();
        int rejected = 0;
        for (int i = 0; i < raw.size(); i++) {
            String reason;
            try {
                FactRecord fact = factNormalizer.normalize(raw.get(i), settings);
                if (date.equals(fact.date())) {
                    facts.add(fact);
                    continue;
                }
                reason = "dt " + fact.date() + " outside batch date";
            } catch (PrecisionException | FactValidationException ex) {
                reason = ex.getMessage();
            }
            rejected++;
            if (examples.size() < MAX_REJECTION_EXAMPLES) {
                examples.add("row " + i + ": " + reason);
            }
        }
        RejectionSummary rejections = new RejectionSummary(facts.size(), rejected, examples);
        if (rejected > 0) {
            log.warn("Rejected {} of {} fact rows for {}: {}", rejected, raw.size(), date, examples);
        }

        List<RollupRow> rows;
        try {
            rows = rollupEngine.rollup(date, facts,
                    properties.rollup().granularitySet(),
                    properties.rollup().population().toRules());
        } catch (InconsistentRollupException ex) {
            log.error("Rollup for {} is inconsistent, nothing persisted: {}", date, ex.getMessage());
            throw ex;
        }
        List<SanityIssue> issues = sanityChecker.check(rows, properties.sanity().ranges());
        rollupStore.replaceRollups(date, rows);
        log.info("Persisted {} rollup rows for {} from {} facts", rows.size(), date, facts.size());
        return new RollupBatch(date, rows, rejections, issues);
    }

    public KpiReport detect(LocalDate date) {
        return detect(date, null);
    }

    /**
     * @param batch the batch just rebuilt for {@code date}, or {@code null} when detection runs
     *              on previously stored rollups
     */
    private KpiReport detect(LocalDate date, RollupBatch batch) {
        RollupRow global = rollupStore.getRollup(date, Granularity.GLOBAL, "")
                .orElseThrow(() -> new RollupNotFoundException(date));
        int windowDays = properties.baseline().windowDays();
        List<AnomalyRule> rules = ruleSource.rules();

        BaselineWindow globalWindow = baselineSelector.select(rollupStore, Granularity.GLOBAL, "", date, windowDays);
        DetectionResult globalResult = anomalyDetectionService.detect(global, globalWindow, rules);

        List<KpiReport.AttributedFinding> attributed = new ArrayList<>();
        List<RuleSkip> skipped = new ArrayList<>(globalResult.skipped());
        if (!globalResult.findings().isEmpty()) {
            List<RollupRow> channelRows = rollupStore.findRollups(date, Granularity.CHANNEL);
            List<List<RollupRow>> channelBaseline = baselineSelector.selectKeyed(
                    rollupStore, Granularity.CHANNEL, globalWindow.dates());
            for (AnomalyFinding finding : globalResult.findings()) {
                List<ContributionEntry> contributions = contributionRanker.rank(finding, channelRows, channelBaseline);
                attributed.add(new KpiReport.AttributedFinding(finding, contributions));
            }
        }

        if (properties.detection().includeChannelRows()) {
            for (RollupRow channelRow : rollupStore.findRollups(date, Granularity.CHANNEL)) {
                BaselineWindow window = baselineSelector.select(
                        rollupStore, Granularity.CHANNEL, channelRow.granularityKey(), date, windowDays);
                DetectionResult result = anomalyDetectionService.detect(channelRow, window, rules);
                result.findings().forEach(finding -> attributed.add(new KpiReport.AttributedFinding(finding, List.of())));
                skipped.addAll(result.skipped());
            }
        }
        attributed.sort(Comparator.comparing(KpiReport.AttributedFinding::finding, AnomalyFinding.PRESENTATION_ORDER));
        skipped.forEach(skip -> log.debug("Rule {} skipped for {}:'{}' with {} valid baseline days",
                skip.rule().name(), skip.granularity(), skip.granularityKey(), skip.validDays()));

        Set<Metric> monitored = new LinkedHashSet<>();
        rules.forEach(rule -> monitored.add(rule.metric()));
        List<MetricComparison> vsPreviousDay = trendComparator.compare(
                global,
                rollupStore.getRollup(date.minusDays(1), Granularity.GLOBAL, ""),
                monitored,
                properties.detection().trendThresholdPercent());

        List<SanityIssue> sanityIssues = batch != null
                ? batch.sanityIssues()
                : sanityChecker.check(storedRows(date), properties.sanity().ranges());

        KpiReport report = new KpiReport(
                date,
                global,
                DetectionStatus.forFindingCount(attributed.size()),
                attributed,
                skipped,
                vsPreviousDay,
                performanceScorer.score(global),
                rollupStore.findRollups(date, Granularity.OS_TYPE),
                sanityIssues,
                batch != null ? batch.rejections() : null,
                TraceContext.traceId().orElse(null));
        log.info("Detection for {} finished with status {} ({} findings, {} skipped rules)",
                date, report.status(), attributed.size(), skipped.size());
        findingConsumers.forEach(consumer -> consumer.accept(report));
        return report;
    }

    public RunResult run(LocalDate date) {
        RollupBatch batch = refreshRollups(date);
        return new RunResult(batch, detect(date, batch));
    }

    private List<RollupRow> storedRows(LocalDate date) {
        List<RollupRow> rows = new ArrayList<>();
        for (Granularity granularity : properties.rollup().granularitySet()) {
            rows.addAll(rollupStore.findRollups(date, granularity));
        }
        return rows;
    }

    /**
     * Runs every date from {@code from} to {@code to} inclusive in ascending order. A date that
     * fails is recorded and the remaining dates still run.
     */
    public BackfillResult backfill(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("from and to must be provided");
        }
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("to must not be before from");
        }
        if (ChronoUnit.DAYS.between(from, to) >= MAX_BACKFILL_DAYS) {
            throw new IllegalArgumentException("backfill range exceeds " + MAX_BACKFILL_DAYS + " days");
        }
        List<LocalDate> completed = new ArrayList<>();
        Map<LocalDate, String> failed = new LinkedHashMap<>();
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            try {
                run(date);
                completed.add(date);
            } catch (KpiException ex) {
                log.error("Backfill of {} failed: {}", date, ex.getMessage());
                failed.put(date, ex.getMessage());
            }
        }
        log.info("Backfill {}..{} finished: {} completed, {} failed", from, to, completed.size(), failed.size());
        return new BackfillResult(completed, failed);
    }
}
