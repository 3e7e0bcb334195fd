package com.growthlens.kpi.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.growthlens.kpi.model.AnomalyFinding;
import com.growthlens.kpi.model.AnomalyRule;
import com.growthlens.kpi.model.BaselineWindow;
import com.growthlens.kpi.model.DetectionResult;
import com.growthlens.kpi.model.Direction;
import com.growthlens.kpi.model.Granularity;
import com.growthlens.kpi.model.Metric;
import com.growthlens.kpi.model.RollupRow;
import com.growthlens.kpi.model.Severity;
import com.growthlens.kpi.model.ThresholdKind;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AnomalyDetectionServiceTest {

    private static final LocalDate TARGET = LocalDate.of(2024, 5, 8);
    private static final AnomalyRule ARPU_DROP_15 = new AnomalyRule("arpu-drop", Metric.ARPU,
            ThresholdKind.PERCENTAGE, 15, Direction.DECREASE, Severity.HIGH, 1);

    private final AnomalyDetectionService service = new AnomalyDetectionService();

    @Test
    void twentyPercentArpuDropTriggersDecreaseRule() {
        RollupRow target = arpuRow(TARGET, 100, 80_000);

        DetectionResult result = service.detect(target, arpuHistory(7, 100, 100_000), List.of(ARPU_DROP_15));

        assertThat(result.findings()).singleElement().satisfies(finding -> {
            assertThat(finding.metric()).isEqualTo(Metric.ARPU);
            assertThat(finding.observedValue()).isCloseTo(8.0d, within(1e-9));
            assertThat(finding.baselineValue()).isCloseTo(10.0d, within(1e-9));
            assertThat(finding.percentChange().value()).isCloseTo(-20.0d, within(1e-9));
            assertThat(finding.absoluteChange()).isCloseTo(-2.0d, within(1e-9));
            assertThat(finding.baselineDays()).isEqualTo(7);
            assertThat(finding.severity()).isEqualTo(Severity.HIGH);
            assertThat(finding.triggeringRule()).isEqualTo(ARPU_DROP_15);
        });
    }

    @Test
    void fourteenPercentDropStaysBelowThreshold() {
        RollupRow target = arpuRow(TARGET, 100, 86_000);

        DetectionResult result = service.detect(target, arpuHistory(7, 100, 100_000), List.of(ARPU_DROP_15));

        assertThat(result.findings()).isEmpty();
        assertThat(result.skipped()).isEmpty();
    }

    @Test
    void decreaseRuleIgnoresIncreases() {
        RollupRow target = arpuRow(TARGET, 100, 150_000);

        assertThat(service.detect(target, arpuHistory(7, 100, 100_000), List.of(ARPU_DROP_15)).findings()).isEmpty();
    }

    @Test
    void insufficientBaselineSkipsRuleInsteadOfFailing() {
        AnomalyRule needsFive = new AnomalyRule("arpu-drop-5d", Metric.ARPU,
                ThresholdKind.PERCENTAGE, 15, Direction.DECREASE, Severity.HIGH, 5);
        RollupRow target = arpuRow(TARGET, 100, 10_000);

        DetectionResult result = service.detect(target, arpuHistory(3, 100, 100_000), List.of(needsFive));

        assertThat(result.findings()).isEmpty();
        assertThat(result.skipped()).singleElement().satisfies(skip -> {
            assertThat(skip.rule()).isEqualTo(needsFive);
            assertThat(skip.validDays()).isEqualTo(3);
        });
    }

    @Test
    void daysWithUndefinedValuesDoNotCountTowardsBaseline() {
        List<RollupRow> rows = new ArrayList<>(arpuHistory(2, 100, 100_000).rows());
        rows.add(arpuRow(TARGET.minusDays(3), 0, 0));
        BaselineWindow window = new BaselineWindow(Granularity.GLOBAL, "", TARGET, 7, rows);
        AnomalyRule needsThree = new AnomalyRule("arpu-drop-3d", Metric.ARPU,
                ThresholdKind.PERCENTAGE, 15, Direction.DECREASE, Severity.HIGH, 3);

        DetectionResult result = service.detect(arpuRow(TARGET, 100, 10_000), window, List.of(needsThree));

        assertThat(result.findings()).isEmpty();
        assertThat(result.skipped()).singleElement()
                .satisfies(skip -> assertThat(skip.validDays()).isEqualTo(2));
    }

    @Test
    void undefinedObservedValueProducesNoFinding() {
        RollupRow target = arpuRow(TARGET, 0, 0);

        DetectionResult result = service.detect(target, arpuHistory(7, 100, 100_000), List.of(ARPU_DROP_15));

        assertThat(result.findings()).isEmpty();
    }

    @Test
    void zeroBaselineLeavesPercentRulesSilentButAbsoluteRulesWork() {
        AnomalyRule absolute = new AnomalyRule("arpu-abs", Metric.ARPU,
                ThresholdKind.ABSOLUTE, 1.0, Direction.INCREASE, Severity.LOW, 1);
        AnomalyRule percent = new AnomalyRule("arpu-pct", Metric.ARPU,
                ThresholdKind.PERCENTAGE, 1.0, Direction.EITHER, Severity.HIGH, 1);

        DetectionResult result = service.detect(arpuRow(TARGET, 100, 50_000),
                arpuHistory(4, 100, 0), List.of(percent, absolute));

        assertThat(result.findings()).singleElement().satisfies(finding -> {
            assertThat(finding.triggeringRule()).isEqualTo(absolute);
            assertThat(finding.percentChange().isDefined()).isFalse();
            assertThat(finding.absoluteChange()).isCloseTo(5.0d, within(1e-9));
        });
    }

    @Test
    void strongestRuleWinsWhenSeveralTriggerOnOneMetric() {
        AnomalyRule low = new AnomalyRule("low", Metric.ARPU, ThresholdKind.PERCENTAGE, 5, Direction.EITHER, Severity.LOW, 1);
        AnomalyRule highLoose = new AnomalyRule("high-loose", Metric.ARPU, ThresholdKind.PERCENTAGE, 10, Direction.EITHER, Severity.HIGH, 1);
        AnomalyRule highStrict = new AnomalyRule("high-strict", Metric.ARPU, ThresholdKind.PERCENTAGE, 18, Direction.EITHER, Severity.HIGH, 1);

        DetectionResult result = service.detect(arpuRow(TARGET, 100, 80_000), arpuHistory(7, 100, 100_000),
                List.of(low, highLoose, highStrict));

        assertThat(result.findings()).singleElement()
                .satisfies(finding -> assertThat(finding.triggeringRule()).isEqualTo(highStrict));
    }

    @Test
    void earlierRuleWinsAFullTie() {
        AnomalyRule first = new AnomalyRule("first", Metric.ARPU, ThresholdKind.PERCENTAGE, 10, Direction.EITHER, Severity.MEDIUM, 1);
        AnomalyRule second = new AnomalyRule("second", Metric.ARPU, ThresholdKind.PERCENTAGE, 10, Direction.DECREASE, Severity.MEDIUM, 1);

        DetectionResult result = service.detect(arpuRow(TARGET, 100, 80_000), arpuHistory(7, 100, 100_000),
                List.of(first, second));

        assertThat(result.findings()).singleElement()
                .satisfies(finding -> assertThat(finding.triggeringRule()).isEqualTo(first));
    }

    @Test
    void oneFindingPerMetric() {
        AnomalyRule arpu = ARPU_DROP_15;
        AnomalyRule users = new AnomalyRule("users", Metric.QUALITY_USERS, ThresholdKind.ABSOLUTE, 10, Direction.DECREASE, Severity.MEDIUM, 1);

        DetectionResult result = service.detect(arpuRow(TARGET, 50, 40_000), arpuHistory(7, 100, 100_000), List.of(arpu, users));

        assertThat(result.findings()).extracting(AnomalyFinding::metric)
                .containsExactly(Metric.ARPU, Metric.QUALITY_USERS);
    }

    @Test
    void increaseExactlyAtThresholdTriggers() {
        AnomalyRule arpuRise15 = new AnomalyRule("arpu-rise", Metric.ARPU,
                ThresholdKind.PERCENTAGE, 15, Direction.INCREASE, Severity.MEDIUM, 1);

        DetectionResult result = service.detect(arpuRow(TARGET, 1, 115), arpuHistory(7, 1, 100), List.of(arpuRise15));

        assertThat(result.findings()).singleElement().satisfies(finding -> {
            assertThat(finding.percentChange().value()).isEqualTo(15.0d);
            assertThat(finding.triggeringRule()).isEqualTo(arpuRise15);
        });
    }

    @Test
    void decreaseExactlyAtThresholdTriggers() {
        DetectionResult result = service.detect(arpuRow(TARGET, 1, 850), arpuHistory(7, 1, 1_000), List.of(ARPU_DROP_15));

        assertThat(result.findings()).singleElement()
                .satisfies(finding -> assertThat(finding.percentChange().value()).isEqualTo(-15.0d));
    }

    @Test
    void eitherDirectionAndAbsoluteRulesAreInclusiveAtThreshold() {
        AnomalyRule eitherTen = new AnomalyRule("arpu-move", Metric.ARPU,
                ThresholdKind.PERCENTAGE, 10, Direction.EITHER, Severity.LOW, 1);
        AnomalyRule rateRise = new AnomalyRule("good-rate-rise", Metric.GOOD_RATE,
                ThresholdKind.ABSOLUTE, 0.1, Direction.INCREASE, Severity.LOW, 1);
        RollupRow target = new RollupRow(TARGET, Granularity.GLOBAL, "", 3, 10, 4, 3, 0, 0, 0, 0, 0, 330, 0);
        List<RollupRow> history = new ArrayList<>();
        for (int offset = 3; offset >= 1; offset--) {
            history.add(new RollupRow(TARGET.minusDays(offset), Granularity.GLOBAL, "", 3, 10, 3, 3, 0, 0, 0, 0, 0, 300, 0));
        }

        DetectionResult result = service.detect(target,
                new BaselineWindow(Granularity.GLOBAL, "", TARGET, 7, history), List.of(eitherTen, rateRise));

        assertThat(result.findings()).extracting(finding -> finding.triggeringRule().name())
                .containsExactlyInAnyOrder("arpu-move", "good-rate-rise");
    }

    @Test
    void justBelowThresholdDoesNotTrigger() {
        AnomalyRule arpuRise15 = new AnomalyRule("arpu-rise", Metric.ARPU,
                ThresholdKind.PERCENTAGE, 15, Direction.INCREASE, Severity.MEDIUM, 1);

        DetectionResult result = service.detect(arpuRow(TARGET, 100, 11_499), arpuHistory(7, 100, 10_000), List.of(arpuRise15));

        assertThat(result.findings()).isEmpty();
    }

    @Test
    void rejectsWindowOfAnotherKey() {
        BaselineWindow channelWindow = new BaselineWindow(Granularity.CHANNEL, "A", TARGET, 7, List.of());

        assertThatThrownBy(() -> service.detect(arpuRow(TARGET, 1, 1), channelWindow, List.of(ARPU_DROP_15)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static BaselineWindow arpuHistory(int days, long qualityUsers, long revenue) {
        List<RollupRow> rows = new ArrayList<>();
        for (int offset = days; offset >= 1; offset--) {
            rows.add(arpuRow(TARGET.minusDays(offset), qualityUsers, revenue));
        }
        return new BaselineWindow(Granularity.GLOBAL, "", TARGET, 7, rows);
    }

    private static RollupRow arpuRow(LocalDate date, long qualityUsers, long revenue) {
        return new RollupRow(date, Granularity.GLOBAL, "", qualityUsers, qualityUsers, qualityUsers, qualityUsers,
                0, 0, 0, 0, 0, revenue, 0);
    }
}
