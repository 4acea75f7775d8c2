package com.libraryindex.agent.core;

import com.libraryindex.agent.cache.AnalysisCache;
import com.libraryindex.agent.config.ResearchProperties;
import com.libraryindex.agent.exception.CollaboratorUnavailableException;
import com.libraryindex.agent.exception.LlmUnavailableException;
import com.libraryindex.agent.exception.ResearchException;
import com.libraryindex.agent.llm.LlmClientFactory;
import com.libraryindex.agent.llm.LlmRole;
import com.libraryindex.agent.model.ResearchRequest;
import com.libraryindex.agent.model.ResearchResponse;
import com.libraryindex.agent.observability.RunContext;
import com.libraryindex.agent.observability.TraceService;
import com.libraryindex.agent.search.AcademicSearchClient;
import com.libraryindex.agent.search.PaperMetadata;
import com.libraryindex.agent.search.SearchRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Adaptive research state machine.
 *
 * INITIALIZING → ANALYZING_QUERY → PLANNING_SEARCH → EXECUTING_SEARCH → PROCESSING_RESULTS
 * → EVALUATING_RESULTS → (REFINING_STRATEGY → PLANNING_SEARCH)* → SYNTHESIZING → COMPLETED
 *
 * Any state may end in FAILED on a permanent collaborator failure or a
 * cancellation request. One state runs at a time on the caller's thread;
 * parallelism exists only inside PROCESSING_RESULTS and SYNTHESIZING, both of
 * which block on a barrier before the next transition.
 */
@Service
@Slf4j
public class ResearchOrchestrator {

    private final LlmClientFactory llmClientFactory;
    private final AcademicSearchClient searchClient;
    private final SearchRateLimiter rateLimiter;
    private final AnalysisCache analysisCache;
    private final QueryAnalyzer queryAnalyzer;
    private final SearchPlanner searchPlanner;
    private final PaperAnalyzer paperAnalyzer;
    private final ResultMerger resultMerger;
    private final ReportFormatter reportFormatter;
    private final SessionRegistry sessionRegistry;
    private final TraceService traceService;
    private final ResearchProperties properties;

    private final Map<ResearchState, StateHandler> handlers = new EnumMap<>(ResearchState.class);

    public ResearchOrchestrator(LlmClientFactory llmClientFactory,
                                AcademicSearchClient searchClient,
                                SearchRateLimiter rateLimiter,
                                AnalysisCache analysisCache,
                                QueryAnalyzer queryAnalyzer,
                                SearchPlanner searchPlanner,
                                PaperAnalyzer paperAnalyzer,
                                ResultMerger resultMerger,
                                ReportFormatter reportFormatter,
                                SessionRegistry sessionRegistry,
                                TraceService traceService,
                                ResearchProperties properties) {
        this.llmClientFactory = llmClientFactory;
        this.searchClient = searchClient;
        this.rateLimiter = rateLimiter;
        this.analysisCache = analysisCache;
        this.queryAnalyzer = queryAnalyzer;
        this.searchPlanner = searchPlanner;
        this.paperAnalyzer = paperAnalyzer;
        this.resultMerger = resultMerger;
        this.reportFormatter = reportFormatter;
        this.sessionRegistry = sessionRegistry;
        this.traceService = traceService;
        this.properties = properties;

        handlers.put(ResearchState.INITIALIZING, (ctx, pool) -> initialize(ctx));
        handlers.put(ResearchState.ANALYZING_QUERY, (ctx, pool) -> analyzeQuery(ctx));
        handlers.put(ResearchState.PLANNING_SEARCH, (ctx, pool) -> planSearch(ctx));
        handlers.put(ResearchState.EXECUTING_SEARCH, (ctx, pool) -> executeSearch(ctx));
        handlers.put(ResearchState.PROCESSING_RESULTS, this::processResults);
        handlers.put(ResearchState.EVALUATING_RESULTS, (ctx, pool) -> evaluateResults(ctx));
        handlers.put(ResearchState.REFINING_STRATEGY, (ctx, pool) -> refineStrategy(ctx));
        handlers.put(ResearchState.SYNTHESIZING, this::synthesize);
    }

    public ResearchResponse run(ResearchRequest request) {
        ResearchProperties.Orchestration defaults = properties.getOrchestration();
        ResearchContext ctx = ResearchContext.builder()
                .sessionId(resolveSessionId(request.getSessionId()))
                .query(request.getQuery())
                .additionalKeywords(request.getAdditionalKeywords())
                .maxWorkers(request.getMaxWorkers() != null ? request.getMaxWorkers() : defaults.getMaxWorkers())
                .maxSearchRetries(request.getMaxSearchRetries() != null
                        ? request.getMaxSearchRetries() : defaults.getMaxSearchRetries())
                .modelOverride(LlmRole.QUERY_ANALYSIS, request.getQueryAnalysisModel())
                .modelOverride(LlmRole.PAPER_ANALYSIS, request.getPaperAnalysisModel())
                .modelOverride(LlmRole.SYNTHESIS, request.getSynthesisModel())
                .runContext(new RunContext())
                .build();

        log.info("Research run started [session={}, workers={}, maxSearchRetries={}, query='{}']",
                ctx.getSessionId(), ctx.getMaxWorkers(), ctx.getMaxSearchRetries(), ctx.getQuery());

        sessionRegistry.register(ctx);
        try (BoundedFanOut pool = new BoundedFanOut("research-" + shortId(ctx), ctx.getMaxWorkers(),
                defaults.getUnitTimeout())) {
            drive(ctx, pool);
        } finally {
            sessionRegistry.unregister(ctx);
        }

        ResearchResponse response = toResponse(ctx);
        traceService.persistTrace(ctx.getQuery(), response, ctx.getRunContext());

        log.info("Research run finished [session={}, state={}, rounds={}, papers={}/{}, latency={}ms, tokens={}]",
                ctx.getSessionId(), ctx.getState(), ctx.getSearchAttempts() + 1,
                response.getPapersAnalyzed(), response.getPapersFound(),
                ctx.getRunContext().elapsedMs(), ctx.getRunContext().totalTokens());
        return response;
    }

    private void drive(ResearchContext ctx, BoundedFanOut pool) {
        while (!ctx.getState().isTerminal()) {
            ResearchState current = ctx.getState();
            try {
                Transition t = handlers.get(current).handle(ctx, pool);
                if (ctx.isCancellationRequested() && !t.next().isTerminal()) {
                    fail(ctx, "cancelled");
                } else if (t.next() == ResearchState.FAILED) {
                    fail(ctx, t.summary());
                } else {
                    ctx.transitionTo(t.next(), t.summary(), t.queries());
                }
            } catch (LlmUnavailableException | CollaboratorUnavailableException e) {
                log.error("[session={}] Fatal collaborator failure in {}: {}",
                        ctx.getSessionId(), current, e.getMessage());
                fail(ctx, e.getMessage());
            } catch (RuntimeException e) {
                log.error("[session={}] Unexpected failure in {}", ctx.getSessionId(), current, e);
                fail(ctx, "Unexpected error in " + current + ": " + e.getMessage());
            }
        }
    }

    // ─── State handlers ──────────────────────────────────────────────────────

    private Transition initialize(ResearchContext ctx) {
        if (!analysisCache.healthCheck()) {
            throw new CollaboratorUnavailableException("analysis cache",
                    analysisCache.describe() + " failed its health check");
        }

        log.info("[session={}] LLM providers:", ctx.getSessionId());
        ctx.setQueryAnalysisLlm(llmClientFactory.forRole(LlmRole.QUERY_ANALYSIS, ctx.modelOverride(LlmRole.QUERY_ANALYSIS)));
        ctx.setPaperAnalysisLlm(llmClientFactory.forRole(LlmRole.PAPER_ANALYSIS, ctx.modelOverride(LlmRole.PAPER_ANALYSIS)));
        ctx.setSynthesisLlm(llmClientFactory.forRole(LlmRole.SYNTHESIS, ctx.modelOverride(LlmRole.SYNTHESIS)));

        return Transition.to(ResearchState.ANALYZING_QUERY,
                "Collaborators ready: cache " + analysisCache.describe());
    }

    private Transition analyzeQuery(ResearchContext ctx) {
        ctx.setKeywords(queryAnalyzer.extractKeywords(ctx));
        return Transition.to(ResearchState.PLANNING_SEARCH, "Keywords: " + ctx.getKeywords());
    }

    private Transition planSearch(ResearchContext ctx) {
        List<String> queries = searchPlanner.plan(ctx.getQueryAnalysisLlm(), ctx.getKeywords(),
                ctx.getRefinementHints(), ctx.getHistory());
        if (queries.isEmpty()) {
            return Transition.to(ResearchState.FAILED, "No untried search query could be planned");
        }
        ctx.setPlannedQueries(queries);
        return Transition.to(ResearchState.EXECUTING_SEARCH, "Planned " + queries.size() + " queries");
    }

    private Transition executeSearch(ResearchContext ctx) {
        int maxResults = properties.getSearch().getMaxResultsPerQuery();
        int newPapers = 0;
        int returned = 0;
        int failedQueries = 0;
        List<String> issued = new ArrayList<>();

        for (String query : ctx.getPlannedQueries()) {
            if (ctx.isCancellationRequested()) break;
            try {
                rateLimiter.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ctx.requestCancellation();
                break;
            } catch (ResearchException e) {
                failedQueries++;
                log.warn("[session={}] Search query skipped: '{}' ({})", ctx.getSessionId(), query, e.getMessage());
                ctx.record(HistoryEntry.of(ResearchState.EXECUTING_SEARCH,
                        "Query '" + query + "' skipped: " + e.getMessage()));
                continue;
            }

            issued.add(query);
            try {
                List<PaperMetadata> found = searchClient.searchMetadata(query, maxResults);
                returned += found.size();
                for (PaperMetadata metadata : found) {
                    if (ctx.addCandidate(metadata)) newPapers++;
                }
            } catch (RuntimeException e) {
                failedQueries++;
                log.warn("[session={}] Search query failed, skipping: '{}' ({})",
                        ctx.getSessionId(), query, e.getMessage());
                ctx.record(HistoryEntry.of(ResearchState.EXECUTING_SEARCH,
                        "Query '" + query + "' failed: " + e.getMessage()));
            }
        }

        ctx.getQualityMetrics().setPapersFound(ctx.getCandidatePapers().size());
        String summary = "%d queries, %d results, %d new papers%s".formatted(issued.size(), returned, newPapers,
                failedQueries > 0 ? ", " + failedQueries + " queries failed" : "");
        return new Transition(ResearchState.PROCESSING_RESULTS, summary, issued);
    }

    private Transition processResults(ResearchContext ctx, BoundedFanOut pool) {
        List<PaperRecord> pending = ctx.pendingPapers();
        if (pending.isEmpty()) {
            return Transition.to(ResearchState.EVALUATING_RESULTS, "No new papers to analyze");
        }

        log.info("[session={}] Analyzing {} papers on {} workers", ctx.getSessionId(), pending.size(), ctx.getMaxWorkers());
        List<BoundedFanOut.Outcome<PaperStatus>> outcomes = pool.runAll(pending, paper -> paperAnalyzer.analyze(paper, ctx));

        LlmUnavailableException fatal = null;
        int analyzed = 0;
        int cached = 0;
        for (int i = 0; i < pending.size(); i++) {
            PaperRecord paper = pending.get(i);
            BoundedFanOut.Outcome<PaperStatus> outcome = outcomes.get(i);

            if (!outcome.succeeded()) {
                if (outcome.error() instanceof LlmUnavailableException e) {
                    fatal = e;
                }
                String reason = outcome.timedOut() ? "timed out" : String.valueOf(outcome.error().getMessage());
                if (paper.markFailed(reason)) {
                    log.warn("[session={}] Paper {} failed: {}", ctx.getSessionId(), paper.getId(), reason);
                    ctx.record(HistoryEntry.of(ResearchState.PROCESSING_RESULTS,
                            "Paper " + paper.getId() + " failed: " + reason));
                }
            }

            if (paper.getStatus() == PaperStatus.ANALYZED) {
                ctx.addPartialResult(paper.getAnalysisText());
                analyzed++;
                if (paper.isFromCache()) cached++;
            }
        }

        QualityMetrics metrics = ctx.getQualityMetrics();
        metrics.setPapersAnalyzed((int) ctx.countPapers(PaperStatus.ANALYZED));
        metrics.setPapersFailed((int) ctx.countPapers(PaperStatus.FAILED));

        if (fatal != null) {
            throw fatal;
        }
        return Transition.to(ResearchState.EVALUATING_RESULTS,
                "Analyzed %d/%d papers (%d from cache)".formatted(analyzed, pending.size(), cached));
    }

    private Transition evaluateResults(ResearchContext ctx) {
        QualityEvaluation evaluation = searchPlanner.evaluate(ctx.getQualityMetrics(), ctx.getSearchAttempts() + 1);
        ctx.setLastEvaluation(evaluation);

        String summary = "found=%d analyzed=%d successRate=%.2f action=%s".formatted(
                evaluation.getPapersFound(), evaluation.getPapersAnalyzed(),
                evaluation.getSuccessRate(), evaluation.getSuggestedAction());

        if (evaluation.isInsufficient() && ctx.canRefine()) {
            return Transition.to(ResearchState.REFINING_STRATEGY, summary);
        }
        if (evaluation.isInsufficient()) {
            summary += " (retry ceiling " + ctx.getMaxSearchRetries() + " reached)";
        }
        return Transition.to(ResearchState.SYNTHESIZING, summary);
    }

    private Transition refineStrategy(ResearchContext ctx) {
        QualityEvaluation evaluation = ctx.getLastEvaluation();
        String previous = ctx.getKeywords();
        ctx.setKeywords(queryAnalyzer.refineKeywords(ctx, evaluation));
        ctx.setRefinementHints(RefinementHints.builder()
                .action(evaluation.getSuggestedAction())
                .build());
        ctx.incrementSearchAttempts();

        return Transition.to(ResearchState.PLANNING_SEARCH,
                "Attempt %d/%d: keywords '%s' → '%s'".formatted(ctx.getSearchAttempts(),
                        ctx.getMaxSearchRetries(), previous, ctx.getKeywords()));
    }

    private Transition synthesize(ResearchContext ctx, BoundedFanOut pool) {
        QualityEvaluation evaluation = ctx.getLastEvaluation();
        boolean lowQuality = evaluation.isInsufficient();

        MergeResult merge = resultMerger.merge(new ArrayList<>(ctx.getPartialResults()), ctx, pool);
        if (merge.interrupted()) {
            ctx.setReport(reportFormatter.formatPartial(ctx, List.of(merge.text())));
            return Transition.to(ResearchState.FAILED, "cancelled");
        }

        ctx.drainPartialResults();
        ctx.setReport(reportFormatter.format(ctx, merge, evaluation, lowQuality));

        String summary = merge.placeholder()
                ? "No content to synthesize"
                : "Merged in %d rounds (%d fallbacks)".formatted(merge.rounds(), merge.fallbacks());
        if (lowQuality) {
            summary += "; low quality: " + evaluation.getSuggestedAction();
        }
        return Transition.to(ResearchState.COMPLETED, summary);
    }

    // ─── Helpers ─────────────────────────────────────────────────────────────

    private void fail(ResearchContext ctx, String detail) {
        ctx.setFailureDetail(detail);
        if (ctx.getReport() == null) {
            ctx.setReport(reportFormatter.formatPartial(ctx, ctx.getPartialResults()));
        }
        ctx.transitionTo(ResearchState.FAILED, detail);
    }

    private ResearchResponse toResponse(ResearchContext ctx) {
        QualityMetrics metrics = ctx.getQualityMetrics();
        QualityEvaluation evaluation = ctx.getLastEvaluation();
        return ResearchResponse.builder()
                .sessionId(ctx.getSessionId())
                .finalState(ctx.getState())
                .report(ctx.getReport())
                .failureDetail(ctx.getFailureDetail())
                .searchAttempts(ctx.getSearchAttempts())
                .papersFound(metrics.getPapersFound())
                .papersAnalyzed(metrics.getPapersAnalyzed())
                .successRate(searchPlanner.score(metrics.getPapersFound(), metrics.getPapersAnalyzed()))
                .lowQuality(evaluation != null && evaluation.isInsufficient())
                .history(new ArrayList<>(ctx.getHistory()))
                .build();
    }

    private static String resolveSessionId(String requested) {
        return requested != null && !requested.isBlank() ? requested : UUID.randomUUID().toString();
    }

    private static String shortId(ResearchContext ctx) {
        String id = ctx.getSessionId();
        return id.length() <= 8 ? id : id.substring(0, 8);
    }

    @FunctionalInterface
    interface StateHandler {
        Transition handle(ResearchContext ctx, BoundedFanOut pool);
    }

    record Transition(ResearchState next, String summary, List<String> queries) {
        static Transition to(ResearchState next, String summary) {
            return new Transition(next, summary, List.of());
        }
    }
}
