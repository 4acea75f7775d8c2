package com.libraryindex.agent.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libraryindex.agent.model.ResearchResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Persists research run traces and exposes analytics.
 *
 * Persistence is @Async so it never delays the research response.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraceService {

    private final ResearchRunTraceRepository traceRepository;
    private final ObjectMapper objectMapper;

    @Async("traceTaskExecutor")
    public void persistTrace(String query, ResearchResponse response, RunContext runCtx) {
        try {
            ResearchRunTrace trace = ResearchRunTrace.builder()
                    .sessionId(response.getSessionId())
                    .query(truncate(query, 4000))
                    .finalState(response.getFinalState().name())
                    .searchAttempts(response.getSearchAttempts())
                    .papersFound(response.getPapersFound())
                    .papersAnalyzed(response.getPapersAnalyzed())
                    .successRate(response.getSuccessRate())
                    .lowQuality(response.isLowQuality())
                    .totalLatencyMs(runCtx.elapsedMs())
                    .llmCalls(runCtx.getLlmCalls())
                    .promptTokens(runCtx.getPromptTokens())
                    .completionTokens(runCtx.getCompletionTokens())
                    .totalTokens(runCtx.totalTokens())
                    .report(truncate(response.getReport(), 8000))
                    .failureDetail(truncate(response.getFailureDetail(), 2000))
                    .historyJson(serializeHistory(response))
                    .build();

            traceRepository.save(trace);

            log.info("Trace persisted [session={}, state={}, latency={}ms, tokens={}]",
                    response.getSessionId(), response.getFinalState(), runCtx.elapsedMs(), runCtx.totalTokens());

        } catch (Exception e) {
            // a lost trace must not affect the research result
            log.error("Failed to persist run trace for session={}", response.getSessionId(), e);
        }
    }

    public List<ResearchRunTrace> getTracesForSession(String sessionId) {
        return traceRepository.findBySessionIdOrderByCreatedAtDesc(sessionId);
    }

    /**
     * Last-24h averages plus an all-time breakdown by terminal state.
     */
    public Map<String, Object> getAnalytics() {
        Instant since24h = Instant.now().minus(24, ChronoUnit.HOURS);

        Double avgLatency = traceRepository.avgLatencySince(since24h);
        Long tokensLast24h = traceRepository.totalTokensUsedSince(since24h);
        Double avgSuccessRate = traceRepository.avgSuccessRateSince(since24h);

        Map<String, Long> stateBreakdown = traceRepository.stateBreakdown().stream()
                .collect(Collectors.toMap(
                        r -> r[0].toString(),
                        r -> ((Number) r[1]).longValue()
                ));

        return Map.of(
                "avgLatencyMsLast24h", avgLatency != null ? Math.round(avgLatency) : 0,
                "totalTokensLast24h", tokensLast24h != null ? tokensLast24h : 0,
                "avgSuccessRateLast24h", avgSuccessRate != null ? avgSuccessRate : 0.0,
                "stateBreakdown", stateBreakdown
        );
    }

    private String serializeHistory(ResearchResponse response) {
        if (response.getHistory() == null || response.getHistory().isEmpty()) return "[]";
        try {
            return objectMapper.writeValueAsString(response.getHistory().stream()
                    .map(h -> Map.of(
                            "state", h.getState().name(),
                            "timestamp", h.getTimestamp().toString(),
                            "summary", h.getSummary() == null ? "" : truncate(h.getSummary(), 500),
                            "queries", h.getQueries()
                    ))
                    .toList());
        } catch (JsonProcessingException e) {
            log.warn("History serialization failed for session={}: {}", response.getSessionId(), e.getMessage());
            return "[]";
        }
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...[truncated]";
    }
}
