package com.libraryindex.agent.observability;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Trace of one research session, persisted to PostgreSQL.
 *
 * The session history is kept as JSONB so a run can be replayed step by step
 * without a join table, e.g.
 * SELECT * FROM research_run_traces WHERE history_json @> '[{"state":"REFINING_STRATEGY"}]'
 */
@Entity
@Table(
    name = "research_run_traces",
    indexes = {
        @Index(name = "idx_trace_session",    columnList = "sessionId"),
        @Index(name = "idx_trace_created_at", columnList = "createdAt"),
        @Index(name = "idx_trace_state",      columnList = "finalState")
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchRunTrace {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String sessionId;

    @Column(nullable = false, length = 4000)
    private String query;

    /** COMPLETED | FAILED */
    @Column(nullable = false)
    private String finalState;

    private int searchAttempts;
    private int papersFound;
    private int papersAnalyzed;
    private double successRate;
    private boolean lowQuality;

    private long totalLatencyMs;

    private int llmCalls;
    private int promptTokens;
    private int completionTokens;
    private int totalTokens;

    @Column(length = 8000)
    private String report;

    @Column(length = 2000)
    private String failureDetail;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private String historyJson;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;
}
