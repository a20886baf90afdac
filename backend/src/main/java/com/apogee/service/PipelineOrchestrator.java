package com.apogee.service;

import com.apogee.config.PipelineProperties;
import com.apogee.dto.pipeline.BatchResult;
import com.apogee.dto.pipeline.MinedTopic;
import com.apogee.dto.pipeline.VideoSpec;
import com.apogee.dto.pipeline.WorkItemResult;
import com.apogee.entity.AgentRunStatus;
import com.apogee.exception.InvariantViolationException;
import com.apogee.exception.PipelineCancelledException;
import com.apogee.exception.QueueUnavailableException;
import com.apogee.monitoring.PipelineMetrics;
import com.apogee.service.approval.ApprovalGate;
import com.apogee.service.audit.RunRecorder;
import com.apogee.service.notification.AlertService;
import com.apogee.service.queue.PipelineStage;
import com.apogee.service.queue.StageJobRunner;
import com.apogee.service.review.RetryLoopProcessor;
import com.apogee.service.state.WorkflowStateStore;
import com.apogee.util.LogIds;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/**
 * PIPELINE ORCHESTRATOR: one batch mines candidate topics for a channel, waits for a human to
 * approve some of them, then drives each approved topic through research, scripting and review.
 *
 * <p>Only one batch runs at a time. A failing topic is contained at its own boundary; anything
 * that fails outside of it (channel lookup, mining, broker outage, cancellation) ends the batch.
 * Either way exactly one audit row is written per started batch.
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    private static final String BANNER = "=".repeat(60);

    private final StageJobRunner stageJobRunner;
    private final ApprovalGate approvalGate;
    private final RetryLoopProcessor retryLoopProcessor;
    private final WorkflowStateStore stateStore;
    private final RunRecorder runRecorder;
    private final AlertService alertService;
    private final PipelineMetrics metrics;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;
    private final TaskExecutor workItemExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object idleMonitor = new Object();

    public PipelineOrchestrator(
            StageJobRunner stageJobRunner,
            ApprovalGate approvalGate,
            RetryLoopProcessor retryLoopProcessor,
            WorkflowStateStore stateStore,
            RunRecorder runRecorder,
            AlertService alertService,
            PipelineMetrics metrics,
            PipelineProperties properties,
            ObjectMapper objectMapper,
            @Qualifier("workItemExecutor") TaskExecutor workItemExecutor) {
        this.stageJobRunner = stageJobRunner;
        this.approvalGate = approvalGate;
        this.retryLoopProcessor = retryLoopProcessor;
        this.stateStore = stateStore;
        this.runRecorder = runRecorder;
        this.alertService = alertService;
        this.metrics = metrics;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.workItemExecutor = workItemExecutor;
    }

    /** Runs a batch for the default channel. */
    public BatchResult runBatch() {
        return runGuarded(null);
    }

    public BatchResult runBatch(UUID channelId) {
        return runGuarded(channelId);
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Blocks until no batch is running or {@code timeout} elapsed.
     *
     * @return true if the orchestrator is idle
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (running.get()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(idleMonitor, remaining);
            }
        }
        return true;
    }

    private BatchResult runGuarded(UUID requestedChannelId) {
        if (!running.compareAndSet(false, true)) {
            log.warn("A pipeline batch is already running, refusing to start another one");
            metrics.incrementBatch("not_started");
            return BatchResult.notStarted();
        }
        try {
            return execute(requestedChannelId);
        } finally {
            synchronized (idleMonitor) {
                running.set(false);
                idleMonitor.notifyAll();
            }
        }
    }

    private BatchResult execute(UUID requestedChannelId) {
        long start = System.currentTimeMillis();
        Timer.Sample sample = metrics.startBatchTimer();
        BatchProgress progress = new BatchProgress();
        progress.channelId = requestedChannelId;

        try {
            if (progress.channelId == null) {
                progress.channelId = stateStore.fetchDefaultChannelId();
            }
            UUID channelId = progress.channelId;

            log.info(BANNER);
            log.info("Pipeline started - channel {}", LogIds.shortId(channelId));
            log.info(BANNER);

            log.info("Step 1/4 - mine topics");
            List<UUID> candidateIds =
                    extractCandidateIds(stageJobRunner.run(PipelineStage.MINE_TOPICS, channelId));
            progress.candidates = candidateIds.size();
            log.info("{} topic(s) created with status pending", candidateIds.size());

            log.info("Step 2/4 - manual approval");
            PipelineProperties.Approval approval = properties.getApproval();
            List<UUID> approvedIds =
                    approvalGate.waitForApprovals(
                            channelId,
                            candidateIds,
                            approval.getTimeout(),
                            approval.getPollInterval());
            if (approvedIds.isEmpty()) {
                log.warn("No topic approved, pipeline finished without work");
                return finishSuccess(progress, start, sample);
            }

            log.info("Step 3/4 - processing {} approved topic(s)", approvedIds.size());
            progress.topicsProcessed = approvedIds.size();
            processItems(approvedIds, progress);

            return finishSuccess(progress, start, sample);
        } catch (RuntimeException e) {
            long durationMs = System.currentTimeMillis() - start;
            log.error("Pipeline failed after {}ms: {}", durationMs, e.getMessage(), e);
            runRecorder.record(
                    progress.channelId,
                    AgentRunStatus.FAILED,
                    progress.candidates,
                    progress.topicsProcessed,
                    progress.succeeded,
                    progress.failed,
                    progress.skipped,
                    durationMs,
                    describe(e));
            alertService.sendError(
                    "Pipeline failed",
                    String.format(
                            "Channel %s: %s", LogIds.shortId(progress.channelId), describe(e)));
            metrics.incrementBatch(AgentRunStatus.FAILED.getLabel());
            metrics.recordBatchTime(sample);
            throw e;
        }
    }

    private BatchResult finishSuccess(BatchProgress progress, long start, Timer.Sample sample) {
        long durationMs = System.currentTimeMillis() - start;
        log.info(
                "Step 4/4 - pipeline finished in {}ms | approved={} | failed={} | skipped={}",
                durationMs,
                progress.succeeded,
                progress.failed,
                progress.skipped);
        runRecorder.record(
                progress.channelId,
                AgentRunStatus.SUCCESS,
                progress.candidates,
                progress.topicsProcessed,
                progress.succeeded,
                progress.failed,
                progress.skipped,
                durationMs,
                null);
        metrics.incrementBatch(AgentRunStatus.SUCCESS.getLabel());
        metrics.recordBatchTime(sample);

        return BatchResult.builder()
                .channelId(progress.channelId)
                .candidates(progress.candidates)
                .topicsProcessed(progress.topicsProcessed)
                .itemsSucceeded(progress.succeeded)
                .itemsFailed(progress.failed)
                .itemsSkipped(progress.skipped)
                .durationMs(durationMs)
                .videoSpecs(List.copyOf(progress.videoSpecs))
                .build();
    }

    private void processItems(List<UUID> topicIds, BatchProgress progress) {
        if (properties.getItemConcurrency() <= 1 || topicIds.size() == 1) {
            for (UUID topicId : topicIds) {
                progress.add(processItem(topicId));
            }
            return;
        }

        List<CompletableFuture<Void>> futures =
                topicIds.stream()
                        .map(
                                topicId ->
                                        CompletableFuture.supplyAsync(
                                                        () -> processItem(topicId),
                                                        workItemExecutor)
                                                .thenAccept(progress::add))
                        .collect(Collectors.toList());
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    /** Item boundary: only batch-fatal errors escape. */
    private WorkItemResult processItem(UUID topicId) {
        WorkItemResult result;
        try {
            result = retryLoopProcessor.process(topicId);
        } catch (PipelineCancelledException | QueueUnavailableException e) {
            throw e;
        } catch (Exception e) {
            String topicTag = LogIds.shortId(topicId);
            log.error("[{}] Error processing topic: {}", topicTag, e.getMessage(), e);
            UUID videoId = markLatestVideoFailed(topicId, describe(e));
            alertService.sendError(
                    "Topic processing failed",
                    String.format("Topic %s: %s", topicTag, describe(e)));
            result = WorkItemResult.failed(topicId, videoId, 0, describe(e));
        }
        metrics.incrementItem(result.getOutcome());
        return result;
    }

    private UUID markLatestVideoFailed(UUID topicId, String reason) {
        try {
            return stateStore
                    .fetchLatestVideo(topicId)
                    .map(
                            video -> {
                                if (!video.getStatus().isTerminal()) {
                                    stateStore.markVideoFailed(video.getId(), reason);
                                }
                                return video.getId();
                            })
                    .orElse(null);
        } catch (Exception e) {
            log.error(
                    "[{}] Could not mark video of topic as failed: {}",
                    LogIds.shortId(topicId),
                    e.getMessage(),
                    e);
            return null;
        }
    }

    List<UUID> extractCandidateIds(JsonNode mined) {
        if (mined == null || !mined.isArray()) {
            throw new InvariantViolationException(
                    "mine_topics returned " + (mined == null ? "nothing" : mined.getNodeType())
                            + " instead of a list of topics");
        }
        Set<UUID> ids = new LinkedHashSet<>();
        for (JsonNode node : mined) {
            MinedTopic topic;
            try {
                topic = objectMapper.treeToValue(node, MinedTopic.class);
            } catch (JsonProcessingException e) {
                throw new InvariantViolationException("Malformed mined topic: " + node, e);
            }
            if (topic == null || topic.getId() == null) {
                throw new InvariantViolationException("Mined topic without id: " + node);
            }
            ids.add(topic.getId());
        }
        return new ArrayList<>(ids);
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /** Counts collected so far; a failed batch records whatever was reached. */
    private static final class BatchProgress {
        private UUID channelId;
        private int candidates;
        private int topicsProcessed;
        private int succeeded;
        private int failed;
        private int skipped;
        private final List<VideoSpec> videoSpecs = new ArrayList<>();

        synchronized void add(WorkItemResult result) {
            switch (result.getOutcome()) {
                case SUCCEEDED -> {
                    succeeded++;
                    videoSpecs.add(result.getVideoSpec());
                }
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
            }
        }
    }
}
