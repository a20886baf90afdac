package com.apogee.service.review;

import com.apogee.config.PipelineProperties;
import com.apogee.dto.pipeline.ReviewResult;
import com.apogee.dto.pipeline.VideoSpec;
import com.apogee.dto.pipeline.WorkItemResult;
import com.apogee.entity.Video;
import com.apogee.entity.VideoStatus;
import com.apogee.exception.InvariantViolationException;
import com.apogee.service.core.CancellationToken;
import com.apogee.service.queue.PipelineStage;
import com.apogee.service.queue.StageJobRunner;
import com.apogee.service.state.WorkflowStateStore;
import com.apogee.util.LogIds;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives one approved topic through research, then alternates script generation and review until
 * the reviewer accepts or the attempt ceiling is reached.
 *
 * <p>Every attempt regenerates the script from scratch; the reviewer always judges the newest
 * script, so nothing is carried over from a rejected attempt.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetryLoopProcessor {

    private final StageJobRunner stageJobRunner;
    private final WorkflowStateStore stateStore;
    private final CancellationToken cancellationToken;
    private final ObjectMapper objectMapper;
    private final PipelineProperties properties;

    public WorkItemResult process(UUID topicId) {
        String topicTag = LogIds.shortId(topicId);

        Optional<Video> existing = stateStore.fetchLatestVideo(topicId);
        if (existing.isPresent() && existing.get().getStatus() == VideoStatus.FAILED) {
            Video failed = existing.get();
            log.warn(
                    "[{}] Video {} already failed ({}), skipping topic",
                    topicTag,
                    LogIds.shortId(failed.getId()),
                    failed.getErrorMessage());
            return WorkItemResult.skipped(topicId, failed.getId(), "video already failed");
        }

        cancellationToken.throwIfCancelled();
        log.info("[{}] Starting research", topicTag);
        stageJobRunner.run(PipelineStage.RESEARCH_TOPIC, topicId);

        UUID videoId =
                stateStore
                        .fetchLatestVideo(topicId)
                        .map(Video::getId)
                        .orElseThrow(
                                () ->
                                        new InvariantViolationException(
                                                "No video found for topic "
                                                        + topicId
                                                        + " after research"));
        String videoTag = LogIds.shortId(videoId);
        log.info("[{}] video_id={}, starting script generation", topicTag, videoTag);

        int maxAttempts = properties.getReview().getMaxAttempts();
        int attempt = 0;
        boolean approved = false;
        while (!approved && attempt < maxAttempts) {
            attempt++;
            cancellationToken.throwIfCancelled();

            log.info("[{}] Attempt {}/{}: write_script", videoTag, attempt, maxAttempts);
            stageJobRunner.run(PipelineStage.WRITE_SCRIPT, topicId);

            log.info("[{}] Attempt {}/{}: check_script", videoTag, attempt, maxAttempts);
            ReviewResult review =
                    parseReview(videoId, stageJobRunner.run(PipelineStage.CHECK_SCRIPT, videoId));

            if (review.isApproved()) {
                log.info(
                        "[{}] Review approved (risk_score={})",
                        videoTag,
                        String.format("%.3f", review.getRiskScore()));
                approved = true;
            } else {
                log.warn(
                        "[{}] Review rejected (risk_score={}). Issues: {}",
                        videoTag,
                        String.format("%.3f", review.getRiskScore()),
                        review.getIssues());
            }
        }

        if (!approved) {
            String reason = String.format("fact_checker: max %d attempts exhausted", maxAttempts);
            stateStore.markVideoFailed(videoId, reason);
            log.error("[{}] Video marked as failed after {} attempts", videoTag, attempt);
            return WorkItemResult.failed(topicId, videoId, attempt, reason);
        }

        VideoSpec spec = stateStore.buildVideoSpec(videoId);
        log.info("[{}] VideoSpec assembled", videoTag);
        return WorkItemResult.succeeded(spec, attempt);
    }

    ReviewResult parseReview(UUID videoId, JsonNode result) {
        if (result == null || !result.isObject()) {
            throw new InvariantViolationException(
                    "check_script returned no review object for video " + videoId);
        }
        if (!result.hasNonNull("risk_score") || !result.hasNonNull("approved")) {
            throw new InvariantViolationException(
                    "check_script result for video " + videoId + " lacks risk_score or approved");
        }

        ReviewResult review;
        try {
            review = objectMapper.treeToValue(result, ReviewResult.class);
        } catch (JsonProcessingException e) {
            throw new InvariantViolationException(
                    "Malformed check_script result for video " + videoId, e);
        }
        if (!review.hasValidRiskScore()) {
            throw new InvariantViolationException(
                    String.format(
                            "check_script returned risk_score=%s outside [0,1] for video %s",
                            review.getRiskScore(), videoId));
        }
        return review;
    }
}
