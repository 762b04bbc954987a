package com.relaygate.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.SequenceGenerator;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.ColumnDefault;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for audit_records table.
 * Durable copy of one call event plus the time it was written.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "audit_records", indexes = {
        @Index(name = "idx_audit_event_timestamp", columnList = "event_timestamp"),
        @Index(name = "idx_audit_tier_timestamp", columnList = "tier, event_timestamp")
})
public class AuditRecordEntity {

    // Must not be IDENTITY: Hibernate cannot batch inserts for identity columns
    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "audit_records_seq")
    @SequenceGenerator(name = "audit_records_seq", sequenceName = "audit_records_seq", allocationSize = 50)
    private Long id;

    // Idempotency key: a replayed batch collapses onto existing rows
    @Column(name = "event_id", nullable = false, unique = true, length = 64)
    private String eventId;

    @Column(name = "event_timestamp", nullable = false)
    private Instant eventTimestamp;

    @Column(name = "written_at", nullable = false)
    private Instant writtenAt;

    @Column(name = "request_id", length = 128)
    private String requestId;

    @Column(name = "source", length = 128)
    private String source;

    @Column(name = "agent_type", length = 128)
    private String agentType;

    @Column(name = "requested_model", length = 128)
    private String requestedModel;

    @Column(name = "model", length = 128)
    private String model;

    @Column(name = "provider", length = 64)
    private String provider;

    @Column(name = "tier", nullable = false, length = 32)
    private String tier;

    @Column(name = "input_tokens", nullable = false)
    private long inputTokens;

    @Column(name = "output_tokens", nullable = false)
    private long outputTokens;

    @ColumnDefault("0")
    @Column(name = "cache_write_tokens", nullable = false)
    private long cacheWriteTokens;

    @ColumnDefault("0")
    @Column(name = "cache_read_tokens", nullable = false)
    private long cacheReadTokens;

    // Null when the model had no pricing entry
    @Column(name = "cost_usd", precision = 18, scale = 8)
    private BigDecimal costUsd;

    @Column(name = "would_be_cost_usd", precision = 18, scale = 8)
    private BigDecimal wouldBeCostUsd;

    @Column(name = "savings_usd", precision = 18, scale = 8)
    private BigDecimal savingsUsd;

    @Column(name = "latency_ms", nullable = false)
    private long latencyMs;

    @Column(name = "ttfb_ms")
    private Long ttfbMs;

    @Column(name = "cache_hit", nullable = false)
    private boolean cacheHit;

    @Column(name = "streamed", nullable = false)
    private boolean streamed;

    @Column(name = "success", nullable = false)
    private boolean success;

    @Column(name = "error_code", length = 64)
    private String errorCode;
}
