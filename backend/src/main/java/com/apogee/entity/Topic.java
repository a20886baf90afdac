package com.apogee.entity;

import com.apogee.converter.TopicStatusConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.OffsetDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

/**
 * Candidate idea produced by the mining stage. Status moves from {@code pending} to {@code
 * approved}/{@code rejected} through an external human action; the orchestrator only reads it.
 */
@Entity
@Immutable
@Table(
        name = "topics",
        indexes = {
            @Index(name = "idx_topics_channel_status", columnList = "channel_id, status")
        })
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class Topic {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "channel_id", nullable = false)
    private UUID channelId;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "rationale", columnDefinition = "TEXT")
    private String rationale;

    @Convert(converter = TopicStatusConverter.class)
    @Column(name = "status", nullable = false, columnDefinition = "topic_status")
    private TopicStatus status;

    @Column(name = "similarity_score")
    private Double similarityScore;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;
}
