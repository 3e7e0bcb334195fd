package com.growthlens.kpi.jobs;

import com.growthlens.kpi.analytics.KpiPipelineService;
import com.growthlens.kpi.error.KpiException;
import com.growthlens.kpi.tracing.TraceContext;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the pipeline once a day for the previous calendar day in the configured zone.
 */
@Component
public class DailyKpiJob {

    private static final Logger log = LoggerFactory.getLogger(DailyKpiJob.class);

    private final KpiPipelineService pipelineService;
    private final boolean enabled;
    private final Clock clock;

    @Autowired
    public DailyKpiJob(KpiPipelineService pipelineService,
                       @Value("${kpi.schedule.enabled:true}") boolean enabled,
                       @Value("${kpi.schedule.zone:UTC}") String zone) {
        this(pipelineService, enabled, Clock.system(ZoneId.of(zone)));
    }

    DailyKpiJob(KpiPipelineService pipelineService, boolean enabled, Clock clock) {
        this.pipelineService = pipelineService;
        this.enabled = enabled;
        this.clock = clock;
    }

    @Scheduled(cron = "${kpi.schedule.cron:0 0 6 * * *}", zone = "${kpi.schedule.zone:UTC}")
    public void runOnSchedule() {
        if (!enabled) {
            log.debug("Daily KPI run disabled");
            return;
        }
        LocalDate date = targetDate();
        TraceContext.set(UUID.randomUUID().toString());
        try {
            KpiPipelineService.RunResult result = pipelineService.run(date);
            log.info("Daily KPI run for {} finished with status {}", date, result.report().status());
        } catch (KpiException ex) {
            log.error("Daily KPI run for {} failed: {}", date, ex.getMessage(), ex);
        } finally {
            TraceContext.clear();
        }
    }

    LocalDate targetDate() {
        return LocalDate.now(clock).minusDays(1);
    }
}
