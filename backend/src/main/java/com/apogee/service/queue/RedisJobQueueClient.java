package com.apogee.service.queue;

import com.apogee.config.PipelineProperties;
import com.apogee.entity.LabeledEnum;
import com.apogee.exception.JobFailedException;
import com.apogee.exception.QueueUnavailableException;
import com.apogee.service.core.CancellationToken;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Job broker on Redis.
 *
 * <p>A job is a hash {@code <prefix>job:<id>} holding the function name, the JSON payload and the
 * lifecycle fields the worker updates ({@code status}, {@code result}, {@code exc_info}). Its id
 * is pushed on the left of {@code <prefix>queue:<queueName>}; workers pop from the right.
 */
@Slf4j
@Service
public class RedisJobQueueClient implements JobQueueClient {

    static final String FIELD_ID = "id";
    static final String FIELD_QUEUE = "queue";
    static final String FIELD_FUNCTION = "function";
    static final String FIELD_PAYLOAD = "payload";
    static final String FIELD_STATUS = "status";
    static final String FIELD_TIMEOUT = "timeout";
    static final String FIELD_ENQUEUED_AT = "enqueued_at";
    static final String FIELD_RESULT = "result";
    static final String FIELD_EXC_INFO = "exc_info";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final RetryTemplate retryTemplate;
    private final CancellationToken cancellationToken;
    private final PipelineProperties.Queue queueProperties;

    public RedisJobQueueClient(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            @Qualifier("jobQueueRetryTemplate") RetryTemplate retryTemplate,
            CancellationToken cancellationToken,
            PipelineProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.retryTemplate = retryTemplate;
        this.cancellationToken = cancellationToken;
        this.queueProperties = properties.getQueue();
    }

    @Override
    public JobHandle enqueue(
            String queueName, String jobFunction, Object payload, Duration timeout) {
        String jobId = UUID.randomUUID().toString();
        Instant enqueuedAt = Instant.now();

        String payloadJson;
        try {
            payloadJson = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Payload of job " + jobFunction + " is not serialisable", e);
        }

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(FIELD_ID, jobId);
        fields.put(FIELD_QUEUE, queueName);
        fields.put(FIELD_FUNCTION, jobFunction);
        fields.put(FIELD_PAYLOAD, payloadJson);
        fields.put(FIELD_STATUS, JobStatus.QUEUED.getLabel());
        fields.put(FIELD_TIMEOUT, String.valueOf(timeout.toSeconds()));
        fields.put(FIELD_ENQUEUED_AT, enqueuedAt.toString());

        String jobKey = jobKey(jobId);
        try {
            // hash first: a worker must never pop an id whose hash does not exist yet
            redisTemplate.<String, String>opsForHash().putAll(jobKey, fields);
            redisTemplate.expire(jobKey, timeout.plus(queueProperties.getResultTtl()));
            redisTemplate.opsForList().leftPush(queueKey(queueName), jobId);
        } catch (DataAccessException e) {
            throw new QueueUnavailableException(
                    queueName,
                    String.format(
                            "Cannot enqueue job '%s' on queue '%s': %s",
                            jobFunction, queueName, e.getMessage()),
                    e);
        }

        log.debug(
                "Enqueued job {} ({}) on queue {} with timeout {}s",
                jobId,
                jobFunction,
                queueName,
                timeout.toSeconds());

        return new JobHandle(jobId, queueName, jobFunction, timeout, enqueuedAt);
    }

    @Override
    public JsonNode awaitResult(JobHandle handle, Duration pollInterval) {
        JobStatus status = readStatus(handle);
        while (!status.isTerminal()) {
            cancellationToken.sleep(pollInterval);
            status = readStatus(handle);
        }

        if (status != JobStatus.FINISHED) {
            String excInfo = readField(handle, FIELD_EXC_INFO);
            throw new JobFailedException(
                    handle.getQueueName(),
                    handle.getJobId(),
                    handle.getJobFunction(),
                    status.getLabel(),
                    excInfo != null && !excInfo.isBlank() ? excInfo : status.getLabel());
        }

        String result = readField(handle, FIELD_RESULT);
        if (result == null || result.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(result);
        } catch (JsonProcessingException e) {
            throw new JobFailedException(
                    handle.getQueueName(),
                    handle.getJobId(),
                    handle.getJobFunction(),
                    JobStatus.FINISHED.getLabel(),
                    "result is not valid JSON: " + e.getOriginalMessage());
        }
    }

    private JobStatus readStatus(JobHandle handle) {
        String label = readField(handle, FIELD_STATUS);
        if (label == null) {
            throw new JobFailedException(
                    handle.getQueueName(),
                    handle.getJobId(),
                    handle.getJobFunction(),
                    "missing",
                    "job hash expired or was deleted before the job finished");
        }
        try {
            return LabeledEnum.fromLabel(JobStatus.class, label);
        } catch (IllegalArgumentException e) {
            log.warn(
                    "Job {} ({}) reports unknown status '{}', treating it as running",
                    handle.getShortId(),
                    handle.getJobFunction(),
                    label);
            return JobStatus.STARTED;
        }
    }

    private String readField(JobHandle handle, String field) {
        HashOperations<String, String, String> hashOps = redisTemplate.opsForHash();
        try {
            return retryTemplate.execute(
                    context -> hashOps.get(jobKey(handle.getJobId()), field));
        } catch (DataAccessException e) {
            throw new QueueUnavailableException(
                    handle.getQueueName(),
                    String.format(
                            "Cannot read job %s on queue '%s': %s",
                            handle.getJobId(), handle.getQueueName(), e.getMessage()),
                    e);
        }
    }

    String jobKey(String jobId) {
        return queueProperties.getKeyPrefix() + "job:" + jobId;
    }

    String queueKey(String queueName) {
        return queueProperties.getKeyPrefix() + "queue:" + queueName;
    }
}
