package com.apogee.health;

import com.apogee.config.PipelineProperties;
import com.apogee.service.queue.PipelineStage;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/** Job broker reachability plus the backlog of every stage queue. */
@Slf4j
@Component("jobQueue")
@RequiredArgsConstructor
public class JobQueueHealthIndicator implements HealthIndicator {

    private final StringRedisTemplate redisTemplate;
    private final PipelineProperties properties;

    @Override
    public Health health() {
        try {
            String pingResult = redisTemplate.execute(RedisConnection::ping, true);
            if (!"PONG".equalsIgnoreCase(pingResult)) {
                return Health.down()
                        .withDetail("message", "Redis ping failed")
                        .withDetail("ping_response", pingResult)
                        .build();
            }

            Map<String, Long> backlog = new LinkedHashMap<>();
            String prefix = properties.getQueue().getKeyPrefix();
            for (PipelineStage stage : PipelineStage.values()) {
                Long size = redisTemplate.opsForList().size(prefix + "queue:" + stage.getQueueName());
                backlog.put(stage.getQueueName(), size != null ? size : 0L);
            }

            log.debug("Job queue health check successful - backlog: {}", backlog);
            return Health.up()
                    .withDetail("message", "Job broker is reachable")
                    .withDetail("queues", backlog)
                    .build();
        } catch (Exception e) {
            log.error("Job queue health check failed: {}", e.getMessage());
            return Health.down()
                    .withDetail("message", "Job broker connection failed")
                    .withDetail("error", e.getMessage())
                    .withDetail("error_type", e.getClass().getSimpleName())
                    .build();
        }
    }
}
