package com.libraryindex.agent.observability;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ResearchRunTraceRepository extends JpaRepository<ResearchRunTrace, Long> {

    List<ResearchRunTrace> findBySessionIdOrderByCreatedAtDesc(String sessionId);

    @Query("SELECT AVG(t.totalLatencyMs) FROM ResearchRunTrace t WHERE t.createdAt >= :since")
    Double avgLatencySince(@Param("since") Instant since);

    @Query("SELECT SUM(t.totalTokens) FROM ResearchRunTrace t WHERE t.createdAt >= :since")
    Long totalTokensUsedSince(@Param("since") Instant since);

    @Query("SELECT AVG(t.successRate) FROM ResearchRunTrace t WHERE t.createdAt >= :since")
    Double avgSuccessRateSince(@Param("since") Instant since);

    @Query("SELECT t.finalState, COUNT(t) FROM ResearchRunTrace t GROUP BY t.finalState")
    List<Object[]> stateBreakdown();
}
