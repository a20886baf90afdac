package com.apogee.service.queue;

import com.apogee.config.PipelineProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs one pipeline stage synchronously: enqueue on the stage's queue with its configured timeout,
 * then block until the worker reports a terminal status.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StageJobRunner {

    private final JobQueueClient jobQueueClient;
    private final PipelineProperties properties;

    public JsonNode run(PipelineStage stage, Object payload) {
        JobHandle handle =
                jobQueueClient.enqueue(
                        stage.getQueueName(), stage.getJobFunction(), payload, timeoutOf(stage));
        log.info(
                "[{}] {} enqueued on {}",
                handle.getShortId(),
                stage.getJobFunction(),
                stage.getQueueName());

        long start = System.currentTimeMillis();
        JsonNode result =
                jobQueueClient.awaitResult(handle, properties.getQueue().getPollInterval());
        log.info(
                "[{}] {} finished in {}ms",
                handle.getShortId(),
                stage.getJobFunction(),
                System.currentTimeMillis() - start);
        return result;
    }

    Duration timeoutOf(PipelineStage stage) {
        PipelineProperties.Queue queue = properties.getQueue();
        return switch (stage) {
            case MINE_TOPICS -> queue.getMiningTimeout();
            case RESEARCH_TOPIC -> queue.getResearchTimeout();
            case WRITE_SCRIPT -> queue.getScriptTimeout();
            case CHECK_SCRIPT -> queue.getReviewTimeout();
        };
    }
}
