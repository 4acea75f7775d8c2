package com.libraryindex.agent.core;

import com.libraryindex.agent.cache.AnalysisCache;
import com.libraryindex.agent.document.DocumentStructurer;
import com.libraryindex.agent.document.RawDocument;
import com.libraryindex.agent.exception.LlmUnavailableException;
import com.libraryindex.agent.llm.CompletionOptions;
import com.libraryindex.agent.model.LlmResponse;
import com.libraryindex.agent.model.Message;
import com.libraryindex.agent.search.AcademicSearchClient;
import com.libraryindex.agent.search.PaperMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Analyzes one pending paper: cache lookup, else relevance screen → fetch →
 * structure → model → cache.
 *
 * A failure marks the record FAILED and is written to the session history; it is
 * not rethrown, except for a permanent model failure, which the orchestrator
 * needs to see to end the session. The cache is written after the record is
 * settled, and a failed write only costs a repeat analysis in a later session.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PaperAnalyzer {

    static final int ANALYSIS_MAX_TOKENS = 2000;

    private static final String SYSTEM_PROMPT = """
            You are an academic paper analyst. Given a research question and the text of a
            paper, extract what the paper contributes to the question:
            - Title and field
            - Problem addressed and main claims
            - Method, data and experimental setup
            - Key results with the numbers that support them
            - Limitations and open problems
            - How the paper relates to the research question
            Stay factual and traceable to the text. Write compact Markdown without preamble.
            """;

    private final AcademicSearchClient searchClient;
    private final DocumentStructurer documentStructurer;
    private final AnalysisCache analysisCache;
    private final ContentFilter contentFilter;
    private final RelevanceScreener relevanceScreener;

    /**
     * @return the status the record ended in
     */
    public PaperStatus analyze(PaperRecord paper, ResearchContext ctx) {
        if (paper.getStatus() != PaperStatus.PENDING) {
            return paper.getStatus();
        }

        Optional<String> cached = analysisCache.lookup(paper.getId());
        if (cached.isPresent()) {
            paper.markAnalyzed(cached.get(), true);
            log.info("[session={}] Paper {} analyzed from cache", ctx.getSessionId(), paper.getId());
            return paper.getStatus();
        }

        String analysis;
        try {
            PaperMetadata metadata = paper.getMetadata();
            Optional<String> screenedOut = relevanceScreener.screen(metadata, ctx);
            if (screenedOut.isPresent()) {
                fail(paper, ctx, screenedOut.get());
                return paper.getStatus();
            }

            RawDocument document = searchClient.fetchDocument(metadata);
            paper.markFetched();

            String text = documentStructurer.toStructuredText(document);
            analysis = requestAnalysis(ctx, metadata, text);
            if (contentFilter.isDegenerate(analysis)) {
                throw new IllegalStateException("model returned no usable analysis");
            }
            paper.markAnalyzed(analysis, false);
            log.info("[session={}] Paper {} analyzed ({} chars)", ctx.getSessionId(), paper.getId(), analysis.length());

        } catch (LlmUnavailableException e) {
            fail(paper, ctx, e);
            throw e;
        } catch (RuntimeException e) {
            fail(paper, ctx, e);
            return paper.getStatus();
        }

        try {
            analysisCache.store(paper.getId(), analysis);
        } catch (RuntimeException e) {
            log.warn("[session={}] Could not cache analysis of {}: {}", ctx.getSessionId(), paper.getId(), e.getMessage());
        }
        return paper.getStatus();
    }

    private String requestAnalysis(ResearchContext ctx, PaperMetadata metadata, String text) {
        String user = "## Research question\n" + ctx.getQuery()
                + "\n\n## Paper\n" + describe(metadata)
                + "\n\n## Full text\n" + text;

        LlmResponse response = ctx.getPaperAnalysisLlm().complete(
                List.of(Message.system(SYSTEM_PROMPT), Message.user(user)),
                CompletionOptions.builder().maxTokens(ANALYSIS_MAX_TOKENS).temperature(0.3).build());
        ctx.getRunContext().addTokens(response.getPromptTokens(), response.getCompletionTokens());
        return response.getContent();
    }

    private void fail(PaperRecord paper, ResearchContext ctx, Exception e) {
        fail(paper, ctx, e.getClass().getSimpleName() + ": " + e.getMessage());
    }

    private void fail(PaperRecord paper, ResearchContext ctx, String reason) {
        if (paper.markFailed(reason)) {
            log.warn("[session={}] Paper {} failed: {}", ctx.getSessionId(), paper.getId(), reason);
            ctx.record(HistoryEntry.of(ResearchState.PROCESSING_RESULTS,
                    "Paper " + paper.getId() + " failed: " + reason));
        }
    }

    static String describe(PaperMetadata metadata) {
        StringBuilder sb = new StringBuilder();
        sb.append("Title: ").append(metadata.getTitle()).append('\n');
        if (metadata.getAuthors() != null && !metadata.getAuthors().isEmpty()) {
            sb.append("Authors: ").append(String.join(", ", metadata.getAuthors())).append('\n');
        }
        if (metadata.getPublished() != null) {
            sb.append("Published: ").append(metadata.getPublished()).append('\n');
        }
        sb.append("arXiv: ").append(metadata.getId());
        return sb.toString();
    }
}
