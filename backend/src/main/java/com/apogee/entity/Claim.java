package com.apogee.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.OffsetDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

/** Factual claim collected by the research stage and scored by the fact checker. */
@Entity
@Immutable
@Table(name = "claims")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class Claim {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "video_id", nullable = false)
    private UUID videoId;

    @Column(name = "claim_text", nullable = false, columnDefinition = "TEXT")
    private String claimText;

    @Column(name = "source_url")
    private String sourceUrl;

    @Column(name = "verified", nullable = false)
    private boolean verified;

    @Column(name = "risk_score", nullable = false)
    private double riskScore;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
