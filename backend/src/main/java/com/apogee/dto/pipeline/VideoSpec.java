package com.apogee.dto.pipeline;

import com.apogee.entity.ScriptBeat;
import com.apogee.entity.VideoStatus;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A fully assembled work item: topic, video, current script and claims. This is what the
 * orchestrator hands to the downstream production stages once review accepted the script.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VideoSpec {
    private UUID videoId;
    private UUID topicId;
    private String topicTitle;
    private UUID channelId;
    private VideoStatus status;
    private List<ClaimSpec> claims;
    private ScriptSpec script;
    private Double similarityScore;
    private Double templateScore;
    private OffsetDateTime createdAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ClaimSpec {
        private String claimText;
        private String sourceUrl;
        /** {@code 1 - risk_score}, rounded to 6 decimals */
        private double confidence;
        private boolean verified;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScriptSpec {
        private String hook;
        private List<ScriptBeat> beats;
        private String payoff;
        private String cta;

        /** Narration text: hook, each beat's fact and analogy, payoff, then the CTA if present. */
        public String getFullText() {
            List<String> parts = new ArrayList<>();
            parts.add(hook);
            if (beats != null) {
                for (ScriptBeat beat : beats) {
                    parts.add(beat.getFact());
                    parts.add(beat.getAnalogy());
                }
            }
            parts.add(payoff);
            if (cta != null && !cta.isBlank()) {
                parts.add(cta);
            }
            return String.join("\n\n", parts);
        }
    }
}
