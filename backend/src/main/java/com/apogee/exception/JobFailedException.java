package com.apogee.exception;

import lombok.Getter;

/**
 * A remote job reached a failed, stopped or canceled terminal state. Aborts the work item that
 * enqueued it, never the batch.
 */
@Getter
public class JobFailedException extends RuntimeException {
    private final String queueName;
    private final String jobId;
    private final String jobFunction;
    private final String terminalStatus;
    private final String reason;

    public JobFailedException(
            String queueName,
            String jobId,
            String jobFunction,
            String terminalStatus,
            String reason) {
        super(
                String.format(
                        "Job '%s' (%s) ended with status=%s: %s",
                        jobFunction, jobId, terminalStatus, reason));
        this.queueName = queueName;
        this.jobId = jobId;
        this.jobFunction = jobFunction;
        this.terminalStatus = terminalStatus;
        this.reason = reason;
    }
}
