package com.apogee.service.notification;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

/**
 * Operator alerts. Every alert is logged at its level; when a Slack webhook is configured it is
 * also posted there. Delivery problems are logged and never reach the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertService {

    private static final DateTimeFormatter FOOTER_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'");

    private final RestTemplate restTemplate;

    @Value("${app.slack.webhook-url:}")
    private String webhookUrl;

    @Value("${app.slack.enabled:true}")
    private boolean enabled;

    public void sendAlert(String title, String message, String level) {
        String normalized = level == null ? "info" : level.toLowerCase();
        String fullMessage = String.format("[%s] %s: %s", normalized.toUpperCase(), title, message);
        switch (normalized) {
            case "error", "critical" -> log.error(fullMessage);
            case "warning", "warn" -> log.warn(fullMessage);
            default -> log.info(fullMessage);
        }

        if (!isSlackEnabled()) {
            return;
        }

        try {
            ResponseEntity<String> response =
                    restTemplate.postForEntity(
                            webhookUrl, buildPayload(title, message, normalized), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                log.warn(
                        "Slack webhook returned {}: {}",
                        response.getStatusCode().value(),
                        response.getBody());
            }
        } catch (Exception e) {
            log.warn("Failed to send Slack alert: {}", e.getMessage());
        }
    }

    public void sendError(String title, String message) {
        sendAlert(title, message, "error");
    }

    public void sendWarning(String title, String message) {
        sendAlert(title, message, "warning");
    }

    public void sendInfo(String title, String message) {
        sendAlert(title, message, "info");
    }

    public boolean isSlackEnabled() {
        return enabled && webhookUrl != null && !webhookUrl.isBlank();
    }

    Map<String, Object> buildPayload(String title, String message, String level) {
        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", getColorForLevel(level));
        attachment.put("text", message);
        attachment.put(
                "footer",
                "Apogee Pipeline • " + ZonedDateTime.now(ZoneOffset.UTC).format(FOOTER_TIME));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", getEmojiForLevel(level) + " *Apogee Engine* - " + title);
        payload.put("attachments", List.of(attachment));
        return payload;
    }

    private String getColorForLevel(String level) {
        return switch (level) {
            case "error", "critical" -> "danger";
            case "warning", "warn" -> "warning";
            case "info" -> "good";
            default -> "";
        };
    }

    private String getEmojiForLevel(String level) {
        return switch (level) {
            case "error", "critical" -> ":red_circle:";
            case "warning", "warn" -> ":warning:";
            case "info" -> ":white_check_mark:";
            default -> ":bell:";
        };
    }
}
