package com.apogee.service.queue;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.apogee.config.PipelineProperties;
import com.apogee.exception.JobFailedException;
import com.apogee.exception.PipelineCancelledException;
import com.apogee.exception.QueueUnavailableException;
import com.apogee.service.core.CancellationToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.retry.support.RetryTemplate;

@ExtendWith(MockitoExtension.class)
class RedisJobQueueClientTest {

    @Mock private StringRedisTemplate redisTemplate;
    @Mock private HashOperations<String, String, String> hashOperations;
    @Mock private ListOperations<String, String> listOperations;

    private CancellationToken cancellationToken;
    private RedisJobQueueClient client;

    private static final Duration POLL = Duration.ofMillis(5);

    @BeforeEach
    void setUp() {
        cancellationToken = new CancellationToken();
        RetryTemplate retryTemplate =
                RetryTemplate.builder()
                        .maxAttempts(3)
                        .fixedBackoff(1)
                        .retryOn(RedisConnectionFailureException.class)
                        .build();
        client =
                new RedisJobQueueClient(
                        redisTemplate,
                        new ObjectMapper(),
                        retryTemplate,
                        cancellationToken,
                        new PipelineProperties());
        lenient().doReturn(hashOperations).when(redisTemplate).opsForHash();
        lenient().doReturn(listOperations).when(redisTemplate).opsForList();
    }

    @Test
    @DisplayName("enqueue writes the job hash, sets its TTL and pushes the id on the queue")
    @SuppressWarnings("unchecked")
    void testEnqueue() {
        UUID videoId = UUID.randomUUID();

        JobHandle handle =
                client.enqueue("fact_checker", "check_script", videoId, Duration.ofSeconds(60));

        ArgumentCaptor<Map<String, String>> fields = ArgumentCaptor.forClass(Map.class);
        verify(hashOperations).putAll(eq("apogee:job:" + handle.getJobId()), fields.capture());
        assertEquals("check_script", fields.getValue().get("function"));
        assertEquals("fact_checker", fields.getValue().get("queue"));
        assertEquals("queued", fields.getValue().get("status"));
        assertEquals("60", fields.getValue().get("timeout"));
        assertEquals("\"" + videoId + "\"", fields.getValue().get("payload"));

        verify(redisTemplate)
                .expire("apogee:job:" + handle.getJobId(), Duration.ofSeconds(60).plusDays(1));
        verify(listOperations).leftPush("apogee:queue:fact_checker", handle.getJobId());
        assertEquals("fact_checker", handle.getQueueName());
        assertEquals(Duration.ofSeconds(60), handle.getTimeout());
    }

    @Test
    @DisplayName("enqueue reports an unreachable broker as QueueUnavailableException")
    void testEnqueueBrokerDown() {
        doThrow(new RedisConnectionFailureException("connection refused"))
                .when(hashOperations)
                .putAll(anyString(), anyMap());

        QueueUnavailableException exception =
                assertThrows(
                        QueueUnavailableException.class,
                        () ->
                                client.enqueue(
                                        "topic_miner", "mine_topics", "x", Duration.ofSeconds(5)));
        assertEquals("topic_miner", exception.getQueueName());
        verifyNoInteractions(listOperations);
    }

    @Test
    @DisplayName("awaitResult polls until finished and returns the parsed result")
    void testAwaitResultFinished() {
        JobHandle handle = handle();
        when(hashOperations.get(jobKey(handle), "status"))
                .thenReturn("queued")
                .thenReturn("started")
                .thenReturn("finished");
        when(hashOperations.get(jobKey(handle), "result"))
                .thenReturn("[{\"id\": \"" + UUID.randomUUID() + "\", \"title\": \"t\"}]");

        JsonNode result = client.awaitResult(handle, POLL);

        assertTrue(result.isArray());
        assertEquals("t", result.get(0).get("title").asText());
        verify(hashOperations, times(3)).get(jobKey(handle), "status");
    }

    @Test
    @DisplayName("A failed job surfaces its remote error text")
    void testAwaitResultFailed() {
        JobHandle handle = handle();
        when(hashOperations.get(jobKey(handle), "status")).thenReturn("failed");
        when(hashOperations.get(jobKey(handle), "exc_info")).thenReturn("ValueError: bad topic");

        JobFailedException exception =
                assertThrows(JobFailedException.class, () -> client.awaitResult(handle, POLL));

        assertEquals("failed", exception.getTerminalStatus());
        assertEquals("ValueError: bad topic", exception.getReason());
        assertTrue(exception.getMessage().contains("research_topic"));
    }

    @Test
    @DisplayName("A stopped job without error text reports its status instead")
    void testAwaitResultStoppedWithoutExcInfo() {
        JobHandle handle = handle();
        when(hashOperations.get(jobKey(handle), "status")).thenReturn("stopped");
        when(hashOperations.get(jobKey(handle), "exc_info")).thenReturn(null);

        JobFailedException exception =
                assertThrows(JobFailedException.class, () -> client.awaitResult(handle, POLL));

        assertEquals("stopped", exception.getReason());
    }

    @Test
    @DisplayName("An expired job hash fails the job")
    void testAwaitResultMissingHash() {
        JobHandle handle = handle();
        when(hashOperations.get(jobKey(handle), "status")).thenReturn(null);

        JobFailedException exception =
                assertThrows(JobFailedException.class, () -> client.awaitResult(handle, POLL));

        assertEquals("missing", exception.getTerminalStatus());
    }

    @Test
    @DisplayName("Transient read errors are retried")
    void testAwaitResultRetriesTransientErrors() {
        JobHandle handle = handle();
        when(hashOperations.get(jobKey(handle), "status"))
                .thenThrow(new RedisConnectionFailureException("blip"))
                .thenReturn("finished");
        when(hashOperations.get(jobKey(handle), "result")).thenReturn("{\"ok\": true}");

        JsonNode result = client.awaitResult(handle, POLL);

        assertTrue(result.get("ok").asBoolean());
    }

    @Test
    @DisplayName("Persistent read errors become QueueUnavailableException")
    void testAwaitResultBrokerDown() {
        JobHandle handle = handle();
        when(hashOperations.get(jobKey(handle), "status"))
                .thenThrow(new RedisConnectionFailureException("down"));

        assertThrows(QueueUnavailableException.class, () -> client.awaitResult(handle, POLL));
        verify(hashOperations, times(3)).get(jobKey(handle), "status");
    }

    @Test
    @DisplayName("A tripped token ends the wait without touching the job")
    void testAwaitResultCancelled() {
        JobHandle handle = handle();
        when(hashOperations.get(jobKey(handle), "status")).thenReturn("started");
        cancellationToken.cancel("shutdown");

        assertThrows(PipelineCancelledException.class, () -> client.awaitResult(handle, POLL));
        verify(hashOperations, never()).put(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("A finished job without a result yields JSON null")
    void testAwaitResultWithoutResult() {
        JobHandle handle = handle();
        when(hashOperations.get(jobKey(handle), "status")).thenReturn("finished");
        when(hashOperations.get(jobKey(handle), "result")).thenReturn(null);

        assertTrue(client.awaitResult(handle, POLL).isNull());
    }

    private JobHandle handle() {
        return new JobHandle(
                UUID.randomUUID().toString(),
                "researcher",
                "research_topic",
                Duration.ofSeconds(120),
                Instant.now());
    }

    private String jobKey(JobHandle handle) {
        return "apogee:job:" + handle.getJobId();
    }
}
