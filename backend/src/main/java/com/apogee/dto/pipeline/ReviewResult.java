package com.apogee.dto.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * Outcome of the {@code check_script} job. On approval the reviewer has already advanced the video
 * to {@code scripted}; on rejection the video is left untouched.
 */
@Data
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReviewResult {

    /** 0.0 to 1.0 */
    @JsonProperty("risk_score")
    private double riskScore;

    @JsonProperty("issues")
    @Builder.Default
    private List<String> issues = List.of();

    @JsonProperty("approved")
    private boolean approved;

    public boolean hasValidRiskScore() {
        return riskScore >= 0.0 && riskScore <= 1.0;
    }
}
