package com.libraryindex.agent.core;

import com.libraryindex.agent.exception.LlmUnavailableException;
import com.libraryindex.agent.llm.CompletionOptions;
import com.libraryindex.agent.model.LlmResponse;
import com.libraryindex.agent.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Keyword work done with the query-analysis model: initial extraction from the
 * research question, and adaptive re-generation during refinement.
 */
@Component
@Slf4j
public class QueryAnalyzer {

    static final int HISTORY_WINDOW = 4;

    private static final String EXTRACTION_PROMPT = """
            You are an expert in analyzing research questions. Produce high-quality search keywords:
            1. Extract the core research concepts and methods.
            2. Identify related fields and sub-fields.
            3. Give diverse keyword combinations.
            4. Balance technical and general terminology.
            Output only the keywords, separated by commas.
            """;

    private static final String REFINEMENT_PROMPT = """
            You optimize literature search strategies. Based on the search history and result
            quality, produce an improved set of search keywords:
            1. If no papers were found, broaden the search with more general terms.
            2. If the analysis success rate is low, make the keywords more precise.
            3. If few papers were found, try related fields or synonyms.
            4. Do not repeat searches that already failed.
            Output only the keywords, separated by commas.
            """;

    /**
     * Keywords for the first planning round. Degenerate output falls back to the raw query.
     */
    public String extractKeywords(ResearchContext ctx) {
        String keywords;
        try {
            keywords = ask(ctx, EXTRACTION_PROMPT, ctx.getQuery(), 0.7);
        } catch (LlmUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[session={}] Keyword extraction failed, using raw query: {}", ctx.getSessionId(), e.getMessage());
            keywords = null;
        }

        if (keywords == null || keywords.isBlank() || keywords.length() < 2) {
            keywords = ctx.getQuery().trim();
        }
        if (ctx.getAdditionalKeywords() != null && !ctx.getAdditionalKeywords().isBlank()) {
            keywords = keywords + ", " + ctx.getAdditionalKeywords().trim();
        }
        return keywords;
    }

    /**
     * New keywords for the next round; keeps the current ones when the model fails.
     */
    public String refineKeywords(ResearchContext ctx, QualityEvaluation evaluation) {
        String prompt = """
                ## Original question
                %s
                ## Current keywords
                %s
                ## Search attempts: %d
                ## Papers found: %d
                ## Analysis success rate: %.2f
                ## Suggested action: %s

                ## Recent history
                %s
                """.formatted(ctx.getQuery(), ctx.getKeywords(), ctx.getSearchAttempts(),
                evaluation.getPapersFound(), evaluation.getSuccessRate(),
                evaluation.getSuggestedAction(), summarizeHistory(ctx.getHistory()));

        try {
            String refined = ask(ctx, REFINEMENT_PROMPT, prompt, 0.3);
            if (refined != null && !refined.isBlank()) {
                return refined;
            }
        } catch (LlmUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[session={}] Keyword refinement failed, keeping current keywords: {}",
                    ctx.getSessionId(), e.getMessage());
        }
        return ctx.getKeywords();
    }

    static String summarizeHistory(List<HistoryEntry> history) {
        if (history.isEmpty()) {
            return "(none)";
        }
        StringBuilder sb = new StringBuilder();
        for (HistoryEntry entry : history.subList(Math.max(0, history.size() - HISTORY_WINDOW), history.size())) {
            sb.append("- ").append(entry.getState()).append(": ").append(entry.getSummary());
            if (!entry.getQueries().isEmpty()) {
                sb.append(" ").append(entry.getQueries());
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private String ask(ResearchContext ctx, String system, String user, double temperature) {
        LlmResponse response = ctx.getQueryAnalysisLlm().complete(
                List.of(Message.system(system), Message.user(user)),
                CompletionOptions.temperature(temperature));
        ctx.getRunContext().addTokens(response.getPromptTokens(), response.getCompletionTokens());
        return response.getContent() == null ? null : response.getContent().trim();
    }
}
