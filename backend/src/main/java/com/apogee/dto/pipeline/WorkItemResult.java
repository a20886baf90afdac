package com.apogee.dto.pipeline;

import java.util.UUID;
import lombok.Builder;
import lombok.Data;

/** Outcome of driving one approved topic through research, scripting and review. */
@Data
@Builder
public class WorkItemResult {

    public enum Outcome {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    private final UUID topicId;
    private final UUID videoId;
    private final Outcome outcome;
    private final int attempts;
    private final VideoSpec videoSpec;
    private final String reason;

    public static WorkItemResult succeeded(VideoSpec spec, int attempts) {
        return WorkItemResult.builder()
                .topicId(spec.getTopicId())
                .videoId(spec.getVideoId())
                .outcome(Outcome.SUCCEEDED)
                .attempts(attempts)
                .videoSpec(spec)
                .build();
    }

    public static WorkItemResult failed(UUID topicId, UUID videoId, int attempts, String reason) {
        return WorkItemResult.builder()
                .topicId(topicId)
                .videoId(videoId)
                .outcome(Outcome.FAILED)
                .attempts(attempts)
                .reason(reason)
                .build();
    }

    public static WorkItemResult skipped(UUID topicId, UUID videoId, String reason) {
        return WorkItemResult.builder()
                .topicId(topicId)
                .videoId(videoId)
                .outcome(Outcome.SKIPPED)
                .reason(reason)
                .build();
    }

    public boolean isSucceeded() {
        return outcome == Outcome.SUCCEEDED;
    }
}
