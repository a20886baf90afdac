package com.apogee.health;

import com.apogee.repository.ChannelConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Database reachability. A database without any configured channel is reported down, since no
 * batch can start against it.
 */
@Slf4j
@Component("workflowStore")
@RequiredArgsConstructor
public class WorkflowStoreHealthIndicator implements HealthIndicator {

    private final JdbcTemplate jdbcTemplate;
    private final ChannelConfigRepository channelConfigRepository;

    @Override
    public Health health() {
        try {
            Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            if (one == null || one != 1) {
                return Health.down().withDetail("message", "SELECT 1 returned " + one).build();
            }

            long channels = channelConfigRepository.count();
            if (channels == 0) {
                return Health.down()
                        .withDetail("message", "No channel configured in channel_config")
                        .withDetail("channels", 0)
                        .build();
            }

            return Health.up()
                    .withDetail("message", "SELECT 1 OK")
                    .withDetail("channels", channels)
                    .build();
        } catch (Exception e) {
            log.error("Workflow store health check failed: {}", e.getMessage());
            return Health.down()
                    .withDetail("message", "Database connection failed")
                    .withDetail("error", e.getMessage())
                    .withDetail("error_type", e.getClass().getSimpleName())
                    .build();
        }
    }
}
