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

/** Channel configuration row. Maintained by the seeding tooling, read-only here. */
@Entity
@Immutable
@Table(name = "channel_config")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class ChannelConfig {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "channel_name", nullable = false)
    private String channelName;

    @Column(name = "niche", nullable = false)
    private String niche;

    @Column(name = "language")
    private String language;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
