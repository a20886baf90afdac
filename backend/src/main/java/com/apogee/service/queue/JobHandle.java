package com.apogee.service.queue;

import com.apogee.util.LogIds;
import java.time.Duration;
import java.time.Instant;
import lombok.Value;

/**
 * Opaque reference to an enqueued job. Enough to re-attach to the job from another process: the
 * broker keeps the job hash under {@code jobId} until its result TTL expires.
 */
@Value
public class JobHandle {
    String jobId;
    String queueName;
    String jobFunction;
    Duration timeout;
    Instant enqueuedAt;

    public String getShortId() {
        return LogIds.shortId(jobId);
    }
}
