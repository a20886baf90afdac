package com.apogee.service.queue;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;

/** Submit work to an external asynchronous job broker and wait for its outcome. */
public interface JobQueueClient {

    /**
     * Enqueues {@code jobFunction} on {@code queueName}.
     *
     * @param payload serialised to JSON as the single job argument
     * @param timeout execution limit the worker enforces
     * @throws com.apogee.exception.QueueUnavailableException if the broker refuses the job
     */
    JobHandle enqueue(String queueName, String jobFunction, Object payload, Duration timeout);

    /**
     * Blocks the calling thread until the job is terminal and returns its return value. Polling is
     * read-only, so the call can be repeated for the same handle.
     *
     * @throws com.apogee.exception.JobFailedException if the job failed, stopped or was canceled
     * @throws com.apogee.exception.QueueUnavailableException if the broker cannot be read
     * @throws com.apogee.exception.PipelineCancelledException if the stop signal fired meanwhile
     */
    JsonNode awaitResult(JobHandle handle, Duration pollInterval);
}
