package com.apogee.service.startup;

import com.apogee.config.DotEnvConfig;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Service;

/**
 * One-shot environment check: required variables, then every health indicator. Prints one OK or
 * FAIL line per dependency.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnvironmentCheckService {

    private final DotEnvConfig dotEnvConfig;
    private final Map<String, HealthIndicator> healthIndicators;

    /** @return true when every check passed */
    public boolean runChecks() {
        log.info("Apogee environment check");
        boolean allOk = true;

        List<String> missing = dotEnvConfig.findMissingRequired();
        if (missing.isEmpty()) {
            ok("ENV VARS", "");
        } else {
            fail("ENV VARS", "missing: " + String.join(", ", missing));
            allOk = false;
        }

        for (Map.Entry<String, HealthIndicator> entry : new TreeMap<>(healthIndicators).entrySet()) {
            String name = entry.getKey();
            Health health;
            try {
                health = entry.getValue().health();
            } catch (Exception e) {
                fail(name, e.getMessage());
                allOk = false;
                continue;
            }
            Object message = health.getDetails().get("message");
            String detail = message != null ? message.toString() : "";
            if (Status.UP.equals(health.getStatus())) {
                ok(name, detail);
            } else {
                Object error = health.getDetails().get("error");
                fail(name, error != null ? detail + " (" + error + ")" : detail);
                allOk = false;
            }
        }

        if (allOk) {
            log.info("All checks passed");
        } else {
            log.error("Environment check failed");
        }
        return allOk;
    }

    private void ok(String label, String detail) {
        log.info("  [OK]   {}{}", label, detail.isEmpty() ? "" : "  -> " + detail);
    }

    private void fail(String label, String reason) {
        log.error("  [FAIL] {}{}", label, reason == null || reason.isEmpty() ? "" : "  -> " + reason);
    }
}
