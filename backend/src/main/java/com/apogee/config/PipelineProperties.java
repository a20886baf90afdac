package com.apogee.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {

    /** Approved topics processed in parallel within one batch; 1 means sequential */
    @Min(1)
    private int itemConcurrency = 1;

    /** How long shutdown waits for a running batch to write its audit row */
    @NotNull private Duration shutdownGracePeriod = Duration.ofSeconds(30);

    @Valid private final Approval approval = new Approval();
    @Valid private final Review review = new Review();
    @Valid private final Schedule schedule = new Schedule();
    @Valid private final Queue queue = new Queue();

    @Getter
    @Setter
    public static class Approval {
        /** Deadline for the human approval gate, in hours */
        @Min(0)
        private long timeoutHours = 48;

        /** Seconds between two approval lookups */
        @Min(1)
        private long pollIntervalSeconds = 60;

        public Duration getTimeout() {
            return Duration.ofHours(timeoutHours);
        }

        public Duration getPollInterval() {
            return Duration.ofSeconds(pollIntervalSeconds);
        }
    }

    @Getter
    @Setter
    public static class Review {
        /** Ceiling of write_script/check_script cycles per video */
        @Min(1)
        private int maxAttempts = 2;
    }

    @Getter
    @Setter
    public static class Schedule {
        /** Whether the recurring schedule starts when no mode flag is given */
        private boolean enabled = true;

        /** Crontab (5 fields) or Spring cron (6 fields) expression */
        @NotBlank private String cron = "0 8 * * *";

        @NotBlank private String zone = "America/Sao_Paulo";
    }

    @Getter
    @Setter
    public static class Queue {
        /** Prefix of every Redis key owned by the job broker */
        @NotBlank private String keyPrefix = "apogee:";

        /** Interval between two status reads of a job hash */
        @NotNull private Duration pollInterval = Duration.ofSeconds(1);

        /** How long finished job hashes are kept */
        @NotNull private Duration resultTtl = Duration.ofDays(1);

        @NotNull private Duration miningTimeout = Duration.ofSeconds(300);
        @NotNull private Duration researchTimeout = Duration.ofSeconds(120);
        @NotNull private Duration scriptTimeout = Duration.ofSeconds(180);
        @NotNull private Duration reviewTimeout = Duration.ofSeconds(60);

        /** Attempts for a single status read before the broker counts as unavailable */
        @Min(1)
        private int readRetryAttempts = 3;
    }
}
