package com.apogee.service.state;

import com.apogee.dto.pipeline.VideoSpec;
import com.apogee.entity.ChannelConfig;
import com.apogee.entity.Claim;
import com.apogee.entity.Script;
import com.apogee.entity.Topic;
import com.apogee.entity.TopicStatus;
import com.apogee.entity.Video;
import com.apogee.entity.VideoStatus;
import com.apogee.exception.InvariantViolationException;
import com.apogee.repository.ChannelConfigRepository;
import com.apogee.repository.ClaimRepository;
import com.apogee.repository.ScriptRepository;
import com.apogee.repository.TopicRepository;
import com.apogee.repository.VideoRepository;
import com.apogee.util.LogIds;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable workflow state shared with the stage workers. Each call runs in its own short
 * transaction, so nothing stays open while the pipeline waits on a job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowStateStore {

    private final ChannelConfigRepository channelConfigRepository;
    private final TopicRepository topicRepository;
    private final VideoRepository videoRepository;
    private final ScriptRepository scriptRepository;
    private final ClaimRepository claimRepository;
    private final WorkflowStateManager stateManager;

    /** Oldest configured channel. */
    @Transactional(readOnly = true)
    public UUID fetchDefaultChannelId() {
        return channelConfigRepository
                .findFirstByOrderByCreatedAtAsc()
                .map(ChannelConfig::getId)
                .orElseThrow(
                        () ->
                                new InvariantViolationException(
                                        "No channel found in channel_config; seed a channel"
                                                + " first"));
    }

    /** Approved topics of {@code channelId} among {@code candidateIds}. */
    @Transactional(readOnly = true)
    public List<UUID> fetchApprovedTopicIds(UUID channelId, Collection<UUID> candidateIds) {
        if (candidateIds == null || candidateIds.isEmpty()) {
            return List.of();
        }
        return topicRepository.findIdsByChannelIdAndStatusAndIdIn(
                channelId, TopicStatus.APPROVED, candidateIds);
    }

    /** Most recently created video of a topic. */
    @Transactional(readOnly = true)
    public Optional<Video> fetchLatestVideo(UUID topicId) {
        return videoRepository.findFirstByTopicIdOrderByCreatedAtDesc(topicId);
    }

    /**
     * Moves the video to {@code failed} with {@code reason}. A video that already failed is left
     * untouched.
     *
     * @throws InvariantViolationException if the video does not exist
     * @throws com.apogee.exception.IllegalStatusTransitionException if the video is published
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markVideoFailed(UUID videoId, String reason) {
        Video video =
                videoRepository
                        .findById(videoId)
                        .orElseThrow(
                                () ->
                                        new InvariantViolationException(
                                                "Video not found with id: " + videoId));

        VideoStatus current = video.getStatus();
        stateManager.validateVideoTransition(videoId, current, VideoStatus.FAILED);
        if (current == VideoStatus.FAILED) {
            log.debug("[{}] Video already failed, keeping its original reason", LogIds.shortId(videoId));
            return;
        }

        video.setStatus(VideoStatus.FAILED);
        video.setErrorMessage(reason);
        video.setUpdatedAt(OffsetDateTime.now());
        videoRepository.save(video);

        log.warn("[{}] Video marked failed ({} -> failed): {}", LogIds.shortId(videoId), current, reason);
    }

    /**
     * Reassembles the work item of a video from its topic, newest script and claims.
     *
     * @throws InvariantViolationException if the video, its topic or its script is missing
     */
    @Transactional(readOnly = true)
    public VideoSpec buildVideoSpec(UUID videoId) {
        Video video =
                videoRepository
                        .findById(videoId)
                        .orElseThrow(
                                () ->
                                        new InvariantViolationException(
                                                "Video not found with id: " + videoId));
        Topic topic =
                topicRepository
                        .findById(video.getTopicId())
                        .orElseThrow(
                                () ->
                                        new InvariantViolationException(
                                                String.format(
                                                        "Topic %s of video %s not found",
                                                        video.getTopicId(), videoId)));
        Script script =
                scriptRepository
                        .findFirstByVideoIdOrderByCreatedAtDesc(videoId)
                        .orElseThrow(
                                () ->
                                        new InvariantViolationException(
                                                "No script found for video " + videoId));

        List<VideoSpec.ClaimSpec> claims =
                claimRepository.findByVideoIdOrderByCreatedAtAsc(videoId).stream()
                        .map(this::toClaimSpec)
                        .collect(Collectors.toList());

        return VideoSpec.builder()
                .videoId(video.getId())
                .topicId(video.getTopicId())
                .topicTitle(topic.getTitle())
                .channelId(video.getChannelId())
                .status(video.getStatus())
                .claims(claims)
                .script(
                        VideoSpec.ScriptSpec.builder()
                                .hook(script.getHook())
                                .beats(
                                        script.getBeats() != null
                                                ? new ArrayList<>(script.getBeats())
                                                : List.of())
                                .payoff(script.getPayoff())
                                .cta(
                                        script.getCta() == null || script.getCta().isBlank()
                                                ? null
                                                : script.getCta())
                                .build())
                .similarityScore(script.getSimilarityScore())
                .templateScore(script.getTemplateScore())
                .createdAt(video.getCreatedAt())
                .build();
    }

    private VideoSpec.ClaimSpec toClaimSpec(Claim claim) {
        return VideoSpec.ClaimSpec.builder()
                .claimText(claim.getClaimText())
                .sourceUrl(claim.getSourceUrl())
                .confidence(confidenceOf(claim.getRiskScore()))
                .verified(claim.isVerified())
                .build();
    }

    static double confidenceOf(double riskScore) {
        return BigDecimal.valueOf(1.0 - riskScore).setScale(6, RoundingMode.HALF_EVEN).doubleValue();
    }
}
