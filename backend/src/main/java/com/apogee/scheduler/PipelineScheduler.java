package com.apogee.scheduler;

import com.apogee.config.PipelineProperties;
import com.apogee.dto.pipeline.BatchResult;
import com.apogee.service.PipelineOrchestrator;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

/** Fires an orchestrator batch on the configured cron expression. */
@Slf4j
@Component
public class PipelineScheduler {

    private final PipelineOrchestrator orchestrator;
    private final ThreadPoolTaskScheduler taskScheduler;
    private final PipelineProperties properties;

    private ScheduledFuture<?> scheduledBatch;

    public PipelineScheduler(
            PipelineOrchestrator orchestrator,
            @Qualifier("pipelineTaskScheduler") ThreadPoolTaskScheduler taskScheduler,
            PipelineProperties properties) {
        this.orchestrator = orchestrator;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
    }

    /**
     * Registers the recurring batch. Idempotent.
     *
     * @throws IllegalArgumentException if the cron expression or the zone is invalid
     */
    public synchronized void start() {
        if (scheduledBatch != null) {
            return;
        }
        PipelineProperties.Schedule schedule = properties.getSchedule();
        String cron = toSpringCron(schedule.getCron());
        ZoneId zone = ZoneId.of(schedule.getZone());

        scheduledBatch =
                taskScheduler.schedule(this::runScheduledBatch, new CronTrigger(cron, zone));
        log.info(
                "Scheduler active - cron: '{}' ({}), next run: {}",
                schedule.getCron(),
                zone,
                CronExpression.parse(cron).next(ZonedDateTime.now(zone)));
    }

    public synchronized void stop() {
        if (scheduledBatch != null) {
            scheduledBatch.cancel(false);
            scheduledBatch = null;
            log.info("Scheduler stopped");
        }
    }

    void runScheduledBatch() {
        log.info("Scheduled pipeline batch starting");
        try {
            BatchResult result = orchestrator.runBatch();
            if (result.isNotStarted()) {
                log.warn("Scheduled batch skipped: previous batch still running");
            } else {
                log.info(
                        "Scheduled batch finished: {} video(s) approved, {} failed",
                        result.getItemsSucceeded(),
                        result.getItemsFailed());
            }
        } catch (Exception e) {
            // already recorded and alerted by the orchestrator; keep the schedule alive
            log.error("Scheduled pipeline batch failed: {}", e.getMessage());
        }
    }

    /** Accepts a 5-field crontab expression by prepending a zero seconds field. */
    static String toSpringCron(String expression) {
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        String cron = fields.length == 5 ? "0 " + trimmed : trimmed;
        if (!CronExpression.isValidExpression(cron)) {
            throw new IllegalArgumentException("Invalid schedule expression: " + expression);
        }
        return cron;
    }
}
