package com.apogee.config;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;

/**
 * Reports the environment variables the pipeline reads. The {@code .env} file itself is loaded by
 * {@link com.apogee.ApogeePipelineApplication} before the context starts.
 */
@Configuration
@Order(Ordered.HIGHEST_PRECEDENCE)
public class DotEnvConfig {

    private static final Logger logger = LoggerFactory.getLogger(DotEnvConfig.class);

    static final Set<String> REQUIRED_VARIABLES = new TreeSet<>(Set.of("DATABASE_URL", "REDIS_URL"));

    static final Set<String> OPTIONAL_VARIABLES =
            new TreeSet<>(
                    Set.of(
                            "DATABASE_USERNAME",
                            "DATABASE_PASSWORD",
                            "SLACK_WEBHOOK_URL",
                            "PIPELINE_SCHEDULE",
                            "PIPELINE_TIMEZONE",
                            "APPROVAL_TIMEOUT_HOURS",
                            "APPROVAL_POLL_INTERVAL_S",
                            "MAX_FACT_CHECK_ATTEMPTS"));

    @PostConstruct
    public void validateEnvironmentVariables() {
        logger.info("Validating required environment variables...");

        List<String> missing = findMissingRequired();
        for (String variable : missing) {
            logger.error("REQUIRED environment variable is missing: {}", variable);
        }

        for (String variable : OPTIONAL_VARIABLES) {
            String value = resolve(variable);
            if (value == null || value.isEmpty() || value.startsWith("placeholder")) {
                logger.debug("Optional environment variable not set, using default: {}", variable);
            } else {
                logger.debug("[OK] Optional variable present: {}", variable);
            }
        }

        if (!missing.isEmpty()) {
            logger.error("================================");
            logger.error("Required environment variables are missing: {}", missing);
            logger.error("Copy .env.example to .env and fill in the values.");
            logger.error("================================");
            // local defaults still apply, startup continues
        } else {
            logger.info("[SUCCESS] All required environment variables are present");
        }
    }

    public List<String> findMissingRequired() {
        List<String> missing = new ArrayList<>();
        for (String variable : REQUIRED_VARIABLES) {
            String value = resolve(variable);
            if (value == null || value.isEmpty()) {
                missing.add(variable);
            }
        }
        return missing;
    }

    /** System property first ({@code .env} entries land there), then the process environment. */
    static String resolve(String variable) {
        String value = System.getProperty(variable);
        if (value == null || value.isEmpty()) {
            value = System.getenv(variable);
        }
        return value;
    }
}
