package com.apogee.entity;

import com.apogee.converter.AgentRunStatusConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Append-only audit row for one agent execution. The stages write their own rows; the
 * orchestrator writes one row per batch under the agent name {@value #ORCHESTRATOR}.
 */
@Entity
@Immutable
@Table(name = "agent_runs")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class AgentRun {

    public static final String ORCHESTRATOR = "orchestrator";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "agent_name", nullable = false, updatable = false)
    private String agentName;

    @Column(name = "video_id", updatable = false)
    private UUID videoId;

    @Column(name = "topic_id", updatable = false)
    private UUID topicId;

    @Convert(converter = AgentRunStatusConverter.class)
    @Column(name = "status", nullable = false, updatable = false, columnDefinition = "agent_status")
    private AgentRunStatus status;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "input_json", nullable = false, updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> inputJson;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "output_json", updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> outputJson;

    @Column(name = "tokens_input", nullable = false, updatable = false)
    @Builder.Default
    private Integer tokensInput = 0;

    @Column(name = "tokens_output", nullable = false, updatable = false)
    @Builder.Default
    private Integer tokensOutput = 0;

    @Column(name = "cost_usd", nullable = false, updatable = false, precision = 10, scale = 6)
    @Builder.Default
    private BigDecimal costUsd = BigDecimal.ZERO;

    @Column(name = "duration_ms", updatable = false)
    private Integer durationMs;

    @Column(name = "error_message", updatable = false, columnDefinition = "TEXT")
    private String errorMessage;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
