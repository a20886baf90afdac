package com.apogee.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** Script written by the scriptwriter stage. Each attempt inserts a new row; newest wins. */
@Entity
@Immutable
@Table(name = "scripts")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class Script {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "video_id", nullable = false)
    private UUID videoId;

    @Column(name = "hook", nullable = false)
    private String hook;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "beats", nullable = false, columnDefinition = "jsonb")
    private List<ScriptBeat> beats;

    @Column(name = "payoff", nullable = false)
    private String payoff;

    @Column(name = "cta")
    private String cta;

    @Column(name = "template_score")
    private Double templateScore;

    @Column(name = "similarity_score")
    private Double similarityScore;

    @Column(name = "version")
    private Integer version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
