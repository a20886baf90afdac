package com.apogee.service.core;

import com.apogee.exception.PipelineCancelledException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-wide stop signal. Every wait of the pipeline (job polling, approval polling) sleeps on
 * this token instead of {@link Thread#sleep}, so tripping it wakes all waiters at once.
 */
@Slf4j
public class CancellationToken {

    private final CountDownLatch latch = new CountDownLatch(1);
    private volatile String reason;

    public void cancel(String reason) {
        if (latch.getCount() > 0) {
            this.reason = reason;
            log.warn("Pipeline cancellation requested: {}", reason);
            latch.countDown();
        }
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    public String getReason() {
        return reason;
    }

    /** @throws PipelineCancelledException if the token has been tripped */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new PipelineCancelledException("Pipeline cancelled: " + reason);
        }
    }

    /**
     * Sleeps for {@code duration} or until the token is tripped, whichever comes first.
     *
     * @throws PipelineCancelledException if the token is or becomes tripped
     */
    public void sleep(Duration duration) {
        throwIfCancelled();
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            if (latch.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
                throwIfCancelled();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineCancelledException("Pipeline wait interrupted");
        }
    }
}
