package com.apogee.config;

import com.apogee.service.PipelineOrchestrator;
import com.apogee.service.core.CancellationToken;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;

/**
 * Stops a running batch when the context closes. Tripping the token ends every job and approval
 * wait; the batch then writes its audit row before the data source goes away. Remote jobs already
 * enqueued keep running on their workers.
 */
@Slf4j
@Configuration
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class PipelineShutdownConfig implements ApplicationListener<ContextClosedEvent> {

    private final CancellationToken cancellationToken;
    private final PipelineOrchestrator orchestrator;
    private final PipelineProperties properties;

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        log.info("Application shutdown initiated - stopping the pipeline");
        cancellationToken.cancel("application shutdown");

        if (!orchestrator.isRunning()) {
            return;
        }

        Duration grace = properties.getShutdownGracePeriod();
        log.info("Waiting up to {}s for the running batch to finish", grace.toSeconds());
        try {
            if (orchestrator.awaitIdle(grace)) {
                log.info("Running batch finished, shutdown continues");
            } else {
                log.warn("Batch still running after {}s, shutting down anyway", grace.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the running batch");
        }
    }
}
