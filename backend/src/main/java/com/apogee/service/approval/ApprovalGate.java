package com.apogee.service.approval;

import com.apogee.service.core.CancellationToken;
import com.apogee.service.state.WorkflowStateStore;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Human approval checkpoint. Topics are approved outside the pipeline; the gate polls the
 * workflow store until at least one candidate is approved or the deadline passes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApprovalGate {

    private final WorkflowStateStore stateStore;
    private final CancellationToken cancellationToken;

    /**
     * Returns the approved subset of {@code candidateIds} as soon as it is non-empty, or an empty
     * list once {@code timeout} elapsed without approvals.
     *
     * @throws com.apogee.exception.PipelineCancelledException if the stop signal fires meanwhile
     */
    public List<UUID> waitForApprovals(
            UUID channelId, List<UUID> candidateIds, Duration timeout, Duration pollInterval) {
        if (candidateIds == null || candidateIds.isEmpty()) {
            return List.of();
        }

        Set<UUID> candidates = new LinkedHashSet<>(candidateIds);
        long deadline = System.nanoTime() + timeout.toNanos();
        log.info(
                "Waiting for manual approval of {} topic(s) (timeout={}h, poll={}s)",
                candidates.size(),
                timeout.toHours(),
                pollInterval.toSeconds());

        while (true) {
            cancellationToken.throwIfCancelled();

            List<UUID> approved =
                    stateStore.fetchApprovedTopicIds(channelId, candidates).stream()
                            .filter(candidates::contains)
                            .distinct()
                            .collect(Collectors.toList());
            if (!approved.isEmpty()) {
                log.info("{} topic(s) approved: {}", approved.size(), approved);
                return approved;
            }

            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0) {
                break;
            }
            Duration remaining = Duration.ofNanos(remainingNanos);
            Duration sleep = pollInterval.compareTo(remaining) < 0 ? pollInterval : remaining;
            log.info(
                    "No topic approved yet, next check in {}s ({} min remaining)",
                    sleep.toSeconds(),
                    remaining.toMinutes());
            cancellationToken.sleep(sleep);
        }

        log.warn("Approval timeout reached ({}h), no topic approved", timeout.toHours());
        return List.of();
    }
}
