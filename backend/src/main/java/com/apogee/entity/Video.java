package com.apogee.entity;

import com.apogee.converter.VideoStatusConverter;
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
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Work item tracked through the review loop and downstream production. Created by the research
 * stage; the orchestrator writes only the {@code failed} status and its error message.
 */
@Data
@Entity
@Table(
        name = "videos",
        indexes = {
            @Index(name = "idx_videos_channel_status", columnList = "channel_id, status"),
            @Index(name = "idx_videos_topic", columnList = "topic_id")
        })
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Video {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "channel_id", nullable = false, updatable = false)
    private UUID channelId;

    @Column(name = "topic_id", nullable = false, updatable = false)
    private UUID topicId;

    @Column(name = "title")
    private String title;

    @Convert(converter = VideoStatusConverter.class)
    @Column(name = "status", nullable = false, columnDefinition = "video_status")
    @Builder.Default
    private VideoStatus status = VideoStatus.DRAFT;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
