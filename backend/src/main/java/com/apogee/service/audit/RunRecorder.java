package com.apogee.service.audit;

import com.apogee.entity.AgentRun;
import com.apogee.entity.AgentRunStatus;
import com.apogee.repository.AgentRunRepository;
import com.apogee.util.LogIds;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Writes the audit row of an orchestrator batch into {@code agent_runs}.
 *
 * <p>Recording is best effort: it runs in its own transaction and a failure is logged, never
 * thrown, so it cannot hide the error that ended the batch.
 */
@Slf4j
@Service
public class RunRecorder {

    private final AgentRunRepository agentRunRepository;
    private final TransactionTemplate auditTransactionTemplate;

    public RunRecorder(
            AgentRunRepository agentRunRepository,
            @Qualifier("auditTransactionTemplate") TransactionTemplate auditTransactionTemplate) {
        this.agentRunRepository = agentRunRepository;
        this.auditTransactionTemplate = auditTransactionTemplate;
    }

    /**
     * @param channelId may be null when the batch failed before the channel was resolved
     * @param error error text of a failed batch, null on success
     * @return whether the row was written
     */
    public boolean record(
            UUID channelId,
            AgentRunStatus status,
            int candidatesProcessed,
            int topicsProcessed,
            int itemsSucceeded,
            int itemsFailed,
            int itemsSkipped,
            long durationMs,
            String error) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("channel_id", channelId != null ? channelId.toString() : null);
        input.put("candidates", candidatesProcessed);
        input.put("topics_processed", topicsProcessed);

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("videos_approved", itemsSucceeded);
        output.put("videos_failed", itemsFailed);
        output.put("videos_skipped", itemsSkipped);

        AgentRun run =
                AgentRun.builder()
                        .agentName(AgentRun.ORCHESTRATOR)
                        .status(status)
                        .inputJson(input)
                        .outputJson(output)
                        .tokensInput(0)
                        .tokensOutput(0)
                        .costUsd(BigDecimal.ZERO)
                        .durationMs((int) Math.min(durationMs, Integer.MAX_VALUE))
                        .errorMessage(error)
                        .build();

        try {
            auditTransactionTemplate.executeWithoutResult(tx -> agentRunRepository.save(run));
            log.info(
                    "Orchestrator run recorded - channel: {}, status: {}, approved: {}, failed:"
                            + " {}, skipped: {}",
                    LogIds.shortId(channelId),
                    status.getLabel(),
                    itemsSucceeded,
                    itemsFailed,
                    itemsSkipped);
            return true;
        } catch (Exception e) {
            log.error(
                    "Failed to record orchestrator run (status={}, error={}): {}",
                    status.getLabel(),
                    error,
                    e.getMessage(),
                    e);
            return false;
        }
    }
}
