package com.growthlens.kpi.controller;

import com.growthlens.kpi.analytics.KpiPipelineService;
import com.growthlens.kpi.controller.dto.BackfillRequestDto;
import com.growthlens.kpi.controller.dto.BackfillResponseDto;
import com.growthlens.kpi.controller.dto.KpiReportResponseDto;
import com.growthlens.kpi.controller.dto.RollupBatchResponseDto;
import com.growthlens.kpi.controller.dto.RollupResponseDto;
import com.growthlens.kpi.controller.dto.RollupsListResponseDto;
import com.growthlens.kpi.controller.dto.RunResponseDto;
import com.growthlens.kpi.error.RollupNotFoundException;
import com.growthlens.kpi.model.AnomalyFinding;
import com.growthlens.kpi.model.Granularity;
import com.growthlens.kpi.model.KpiReport;
import com.growthlens.kpi.model.Metric;
import com.growthlens.kpi.model.PerformanceScore;
import com.growthlens.kpi.model.Ratio;
import com.growthlens.kpi.model.RejectionSummary;
import com.growthlens.kpi.model.RollupBatch;
import com.growthlens.kpi.model.RollupRow;
import com.growthlens.kpi.model.SanityIssue;
import com.growthlens.kpi.money.MinorUnits;
import com.growthlens.kpi.repository.RollupStore;
import com.growthlens.kpi.tracing.TraceContext;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/kpi")
public class KpiController {

    private static final int RATE_SCALE = 4;
    private static final int MONEY_SCALE = 2;
    private static final int PERCENT_SCALE = 2;

    private final KpiPipelineService pipelineService;
    private final RollupStore rollupStore;

    public KpiController(KpiPipelineService pipelineService, RollupStore rollupStore) {
        this.pipelineService = pipelineService;
        this.rollupStore = rollupStore;
    }

    @GetMapping("/rollups/{date}")
    public ResponseEntity<RollupsListResponseDto> getRollups(
            @PathVariable("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(value = "granularity", required = false, defaultValue = "GLOBAL") Granularity granularity
    ) {
        List<RollupRow> rows = rollupStore.findRollups(date, granularity);
        if (rows.isEmpty() && granularity == Granularity.GLOBAL) {
            throw new RollupNotFoundException(date);
        }
        return ResponseEntity.ok(new RollupsListResponseDto(
                date,
                granularity.name(),
                rows.stream().map(KpiController::mapRow).toList(),
                currentTraceId()));
    }

    @PostMapping("/rollups/{date}/refresh")
    public ResponseEntity<RollupBatchResponseDto> refreshRollups(
            @PathVariable("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(mapBatch(pipelineService.refreshRollups(date)));
    }

    @GetMapping("/reports/{date}")
    public ResponseEntity<KpiReportResponseDto> getReport(
            @PathVariable("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(mapReport(pipelineService.detect(date)));
    }

    @PostMapping("/runs/{date}")
    public ResponseEntity<RunResponseDto> run(
            @PathVariable("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        KpiPipelineService.RunResult result = pipelineService.run(date);
        return ResponseEntity.ok(new RunResponseDto(mapBatch(result.batch()), mapReport(result.report())));
    }

    @PostMapping("/backfill")
    public ResponseEntity<BackfillResponseDto> backfill(@Valid @RequestBody BackfillRequestDto request) {
        KpiPipelineService.BackfillResult result = pipelineService.backfill(request.from(), request.to());
        return ResponseEntity.ok(new BackfillResponseDto(result.completed(), result.failed(), currentTraceId()));
    }

    private RollupBatchResponseDto mapBatch(RollupBatch batch) {
        return new RollupBatchResponseDto(
                batch.date(),
                batch.rows().size(),
                mapRejections(batch.rejections()),
                mapIssues(batch.sanityIssues()),
                batch.global().map(KpiController::mapRow).orElse(null),
                currentTraceId()
        );
    }

    private KpiReportResponseDto mapReport(KpiReport report) {
        return new KpiReportResponseDto(
                report.date(),
                report.status().name(),
                mapRow(report.global()),
                report.findings().stream().map(KpiController::mapFinding).toList(),
                report.skipped().stream()
                        .map(skip -> new KpiReportResponseDto.SkippedRule(
                                skip.rule().name(),
                                skip.granularity().name(),
                                skip.granularityKey(),
                                skip.validDays()))
                        .toList(),
                report.vsPreviousDay().stream()
                        .map(comparison -> new KpiReportResponseDto.Comparison(
                                comparison.metric().name(),
                                metricValue(comparison.metric(), comparison.current()),
                                metricValue(comparison.metric(), comparison.previous()),
                                comparison.percentChange().toDecimal(PERCENT_SCALE),
                                comparison.significant()))
                        .toList(),
                mapPerformance(report.performance()),
                report.osBreakdown().stream().map(KpiController::mapRow).toList(),
                mapIssues(report.sanityIssues()),
                report.rejections() != null ? mapRejections(report.rejections()) : null,
                report.traceId() != null ? report.traceId() : currentTraceId()
        );
    }

    private static RollupBatchResponseDto.Rejections mapRejections(RejectionSummary rejections) {
        return new RollupBatchResponseDto.Rejections(
                rejections.accepted(),
                rejections.rejected(),
                rejections.examples());
    }

    private static List<RollupBatchResponseDto.SanityIssue> mapIssues(List<SanityIssue> issues) {
        return issues.stream()
                .map(issue -> new RollupBatchResponseDto.SanityIssue(
                        issue.level().name(),
                        issue.granularity().name(),
                        issue.granularityKey(),
                        issue.check(),
                        issue.message()))
                .toList();
    }

    private static KpiReportResponseDto.Performance mapPerformance(PerformanceScore performance) {
        return new KpiReportResponseDto.Performance(
                performance.score(),
                performance.maxScore(),
                performance.grade().name(),
                performance.items().stream()
                        .map(item -> new KpiReportResponseDto.PerformanceItem(
                                item.metric().name(),
                                metricValue(item.metric(), item.value()),
                                item.points(),
                                item.maxPoints()))
                        .toList());
    }

    private static KpiReportResponseDto.Finding mapFinding(KpiReport.AttributedFinding attributed) {
        AnomalyFinding finding = attributed.finding();
        Metric metric = finding.metric();
        return new KpiReportResponseDto.Finding(
                metric.name(),
                finding.granularity().name(),
                finding.granularityKey(),
                metricValue(metric, Ratio.of(finding.observedValue())),
                metricValue(metric, Ratio.of(finding.baselineValue())),
                finding.percentChange().toDecimal(PERCENT_SCALE),
                metricValue(metric, Ratio.of(finding.absoluteChange())),
                finding.baselineDays(),
                finding.severity().name(),
                finding.triggeringRule().name(),
                attributed.contributions().stream()
                        .map(entry -> new KpiReportResponseDto.Contribution(
                                entry.channelKey(),
                                entry.deltaContribution(),
                                entry.denominatorDelta(),
                                entry.sharePercent().toDecimal(PERCENT_SCALE),
                                entry.rank()))
                        .toList()
        );
    }

    static RollupResponseDto mapRow(RollupRow row) {
        return new RollupResponseDto(
                row.date(),
                row.granularity().name(),
                row.granularityKey(),
                new RollupResponseDto.Counts(
                        row.qualityUsers(),
                        row.allUsers(),
                        row.goodUsers(),
                        row.verifiedUsers(),
                        row.retainedUsers(),
                        row.payingUsers(),
                        row.femaleUsers(),
                        row.youngUsers(),
                        row.highTierUsers()),
                MinorUnits.toMajorUnits(row.totalRevenue()),
                MinorUnits.toMajorUnits(row.totalCost()),
                new RollupResponseDto.Ratios(
                        row.goodRate().toDecimal(RATE_SCALE),
                        row.verifiedRate().toDecimal(RATE_SCALE),
                        row.qualityRate().toDecimal(RATE_SCALE),
                        row.retentionRate().toDecimal(RATE_SCALE),
                        row.conversionRate().toDecimal(RATE_SCALE),
                        row.arpu().toDecimal(MONEY_SCALE),
                        row.cpa().toDecimal(MONEY_SCALE),
                        row.femaleRatio().toDecimal(RATE_SCALE),
                        row.youngRatio().toDecimal(RATE_SCALE),
                        row.highTierRatio().toDecimal(RATE_SCALE))
        );
    }

    private static BigDecimal metricValue(Metric metric, Ratio value) {
        if (!value.isDefined()) {
            return null;
        }
        if (metric.isMonetary()) {
            return value.toDecimal(MONEY_SCALE);
        }
        if (metric.isRatio()) {
            return value.toDecimal(RATE_SCALE);
        }
        return BigDecimal.valueOf(value.value()).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private static String currentTraceId() {
        return TraceContext.traceId().orElse(null);
    }
}
