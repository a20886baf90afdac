package com.apogee.monitoring;

import com.apogee.dto.pipeline.WorkItemResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/** Batch and work item metrics of the orchestrator. */
@Component
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;

    private final Timer batchTimer;

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.batchTimer =
                Timer.builder("apogee.pipeline.batch.duration")
                        .description("Wall time of one orchestrator batch, approval wait included")
                        .register(meterRegistry);
    }

    public void incrementBatch(String status) {
        Counter.builder("apogee.pipeline.batches")
                .description("Orchestrator batches by final status")
                .tag("status", status)
                .register(meterRegistry)
                .increment();
    }

    public void incrementItem(WorkItemResult.Outcome outcome) {
        Counter.builder("apogee.pipeline.items")
                .description("Approved topics processed, by outcome")
                .tag("outcome", outcome.name().toLowerCase())
                .register(meterRegistry)
                .increment();
    }

    public Timer.Sample startBatchTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordBatchTime(Timer.Sample sample) {
        sample.stop(batchTimer);
    }
}
