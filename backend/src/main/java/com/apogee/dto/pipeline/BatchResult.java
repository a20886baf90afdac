package com.apogee.dto.pipeline;

import java.util.List;
import java.util.UUID;
import lombok.Builder;
import lombok.Data;

/** Summary of one orchestrator batch. */
@Data
@Builder
public class BatchResult {
    private final UUID channelId;
    private final int candidates;
    private final int topicsProcessed;
    private final int itemsSucceeded;
    private final int itemsFailed;
    private final int itemsSkipped;
    private final long durationMs;
    @Builder.Default private final List<VideoSpec> videoSpecs = List.of();

    /** True when the batch did not run because another one was still in flight. */
    private final boolean notStarted;

    public static BatchResult notStarted() {
        return BatchResult.builder().notStarted(true).build();
    }
}
