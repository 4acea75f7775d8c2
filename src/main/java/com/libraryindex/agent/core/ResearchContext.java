package com.libraryindex.agent.core;

import com.libraryindex.agent.llm.LlmClient;
import com.libraryindex.agent.llm.LlmRole;
import com.libraryindex.agent.llm.ModelSelection;
import com.libraryindex.agent.observability.RunContext;
import com.libraryindex.agent.search.PaperMetadata;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one research session, passed explicitly to every state handler.
 *
 * Owned by the orchestrator thread. Worker threads touch only their own
 * {@link PaperRecord}, the history (append-only, thread-safe) and the
 * {@link RunContext} counters.
 */
@Slf4j
@Getter
public class ResearchContext {

    private final String sessionId;
    private final String query;
    private final String additionalKeywords;
    private final int maxWorkers;
    private final int maxSearchRetries;

    @Setter
    private LlmClient queryAnalysisLlm;
    @Setter
    private LlmClient paperAnalysisLlm;
    @Setter
    private LlmClient synthesisLlm;

    private final RunContext runContext;

    @Getter(AccessLevel.NONE)
    private final Map<LlmRole, ModelSelection> modelOverrides;

    @Getter(AccessLevel.NONE)
    private final List<HistoryEntry> history = new CopyOnWriteArrayList<>();

    @Getter(AccessLevel.NONE)
    private final Map<String, PaperRecord> candidatePapers = new LinkedHashMap<>();

    @Getter(AccessLevel.NONE)
    private final List<String> partialResults = new ArrayList<>();

    private final QualityMetrics qualityMetrics = new QualityMetrics();

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean cancellationRequested = new AtomicBoolean();

    private ResearchState state = ResearchState.INITIALIZING;
    private int searchAttempts;

    @Setter
    private String keywords;

    @Setter
    private RefinementHints refinementHints = RefinementHints.NONE;

    @Setter
    private List<String> plannedQueries = List.of();

    @Setter
    private QualityEvaluation lastEvaluation;

    @Setter
    private String report;

    @Setter
    private String failureDetail;

    @Builder
    private ResearchContext(String sessionId, String query, String additionalKeywords,
                            int maxWorkers, int maxSearchRetries,
                            LlmClient queryAnalysisLlm, LlmClient paperAnalysisLlm, LlmClient synthesisLlm,
                            @Singular Map<LlmRole, ModelSelection> modelOverrides,
                            RunContext runContext) {
        this.sessionId = sessionId;
        this.query = query;
        this.additionalKeywords = additionalKeywords;
        this.maxWorkers = maxWorkers;
        this.maxSearchRetries = maxSearchRetries;
        this.queryAnalysisLlm = queryAnalysisLlm;
        this.paperAnalysisLlm = paperAnalysisLlm;
        this.synthesisLlm = synthesisLlm;
        this.modelOverrides = new EnumMap<>(LlmRole.class);
        modelOverrides.forEach((role, selection) -> {
            if (selection != null) this.modelOverrides.put(role, selection);
        });
        this.runContext = runContext != null ? runContext : new RunContext();
    }

    /** Per-request model for a role, or null to use the configured default. */
    public ModelSelection modelOverride(LlmRole role) {
        return modelOverrides.get(role);
    }

    // ─── State & history ─────────────────────────────────────────────────────

    /**
     * Records what the current state did, then moves to {@code next}.
     *
     * @param queries search expressions issued by the current state, if any
     */
    public void transitionTo(ResearchState next, String summary, List<String> queries) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Session " + sessionId + " already " + state);
        }
        log.info("[session={}] {} → {}: {}", sessionId, state, next, summary);
        history.add(HistoryEntry.builder()
                .state(state)
                .timestamp(Instant.now())
                .summary(summary)
                .queries(queries == null ? List.of() : queries)
                .build());
        state = next;
    }

    public void transitionTo(ResearchState next, String summary) {
        transitionTo(next, summary, List.of());
    }

    /** Appends without changing state; safe from worker threads. */
    public void record(HistoryEntry entry) {
        history.add(entry);
    }

    public void record(String summary) {
        history.add(HistoryEntry.of(state, summary));
    }

    public List<HistoryEntry> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /** Every search expression issued so far in this session. */
    public Set<String> issuedQueries() {
        Set<String> issued = new LinkedHashSet<>();
        for (HistoryEntry entry : history) {
            issued.addAll(entry.getQueries());
        }
        return issued;
    }

    // ─── Attempts ────────────────────────────────────────────────────────────

    public boolean canRefine() {
        return searchAttempts < maxSearchRetries;
    }

    public void incrementSearchAttempts() {
        if (!canRefine()) {
            throw new IllegalStateException("searchAttempts would exceed " + maxSearchRetries);
        }
        searchAttempts++;
    }

    // ─── Papers ──────────────────────────────────────────────────────────────

    /**
     * Adds a candidate, or merges metadata into the existing record for that id.
     *
     * @return true when the id was new
     */
    public boolean addCandidate(PaperMetadata metadata) {
        if (metadata == null || metadata.getId() == null || metadata.getId().isBlank()) {
            return false;
        }
        PaperRecord existing = candidatePapers.get(metadata.getId());
        if (existing != null) {
            existing.mergeMetadata(metadata);
            return false;
        }
        candidatePapers.put(metadata.getId(), new PaperRecord(metadata));
        return true;
    }

    public Map<String, PaperRecord> getCandidatePapers() {
        return Collections.unmodifiableMap(candidatePapers);
    }

    public List<PaperRecord> pendingPapers() {
        return candidatePapers.values().stream()
                .filter(p -> p.getStatus() == PaperStatus.PENDING)
                .toList();
    }

    public long countPapers(PaperStatus status) {
        return candidatePapers.values().stream().filter(p -> p.getStatus() == status).count();
    }

    // ─── Partial results ─────────────────────────────────────────────────────

    public void addPartialResult(String text) {
        partialResults.add(text);
    }

    public List<String> getPartialResults() {
        return Collections.unmodifiableList(partialResults);
    }

    /** Hands all partial results to the caller and empties the buffer. */
    public List<String> drainPartialResults() {
        List<String> drained = new ArrayList<>(partialResults);
        partialResults.clear();
        return drained;
    }

    // ─── Cancellation ────────────────────────────────────────────────────────

    public void requestCancellation() {
        cancellationRequested.set(true);
    }

    public boolean isCancellationRequested() {
        return cancellationRequested.get();
    }
}
