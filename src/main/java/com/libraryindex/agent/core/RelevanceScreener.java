package com.libraryindex.agent.core;

import com.libraryindex.agent.config.ResearchProperties;
import com.libraryindex.agent.exception.LlmUnavailableException;
import com.libraryindex.agent.llm.CompletionOptions;
import com.libraryindex.agent.model.LlmResponse;
import com.libraryindex.agent.model.Message;
import com.libraryindex.agent.search.PaperMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores a paper's abstract against the research question before its full text
 * is downloaded, so off-topic hits cost one short model call instead of a PDF
 * and a full analysis.
 *
 * Papers without an abstract, and papers whose score cannot be obtained, are
 * let through. Only a permanent model failure propagates.
 */
@Component
@Slf4j
public class RelevanceScreener {

    static final int SCORE_MAX_TOKENS = 10;

    private static final String SYSTEM_PROMPT = """
            You rate how relevant a paper abstract is to a research question.
            Answer with a single integer from 0 (unrelated) to 100 (directly addresses
            the question) and nothing else.
            """;

    private static final Pattern SCORE = Pattern.compile("\\d{1,3}");

    private final boolean enabled;
    private final double minScore;

    public RelevanceScreener(ResearchProperties properties) {
        this(properties.getRelevance().isEnabled(), properties.getRelevance().getMinScore());
    }

    RelevanceScreener(boolean enabled, double minScore) {
        this.enabled = enabled;
        this.minScore = minScore;
    }

    /**
     * @return why the paper should be skipped, or empty when it should be analyzed
     */
    public Optional<String> screen(PaperMetadata metadata, ResearchContext ctx) {
        if (!enabled) {
            return Optional.empty();
        }
        if (metadata.getSummary() == null || metadata.getSummary().isBlank()) {
            log.debug("[session={}] No abstract for {}, skipping relevance check", ctx.getSessionId(), metadata.getId());
            return Optional.empty();
        }

        OptionalDouble score;
        try {
            score = parseScore(requestScore(ctx, metadata));
        } catch (LlmUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[session={}] Relevance check for {} failed, analyzing anyway: {}",
                    ctx.getSessionId(), metadata.getId(), e.getMessage());
            return Optional.empty();
        }

        if (score.isEmpty()) {
            log.warn("[session={}] Unreadable relevance score for {}, analyzing anyway", ctx.getSessionId(), metadata.getId());
            return Optional.empty();
        }
        if (score.getAsDouble() >= minScore) {
            log.info("[session={}] Paper {} passed relevance check ({})",
                    ctx.getSessionId(), metadata.getId(), format(score.getAsDouble()));
            return Optional.empty();
        }

        log.info("[session={}] Paper {} screened out ({} < {})",
                ctx.getSessionId(), metadata.getId(), format(score.getAsDouble()), format(minScore));
        return Optional.of("below relevance threshold (" + format(score.getAsDouble()) + " < " + format(minScore) + ")");
    }

    private String requestScore(ResearchContext ctx, PaperMetadata metadata) {
        String user = "## Research question\n" + ctx.getQuery()
                + "\n\n## Title\n" + metadata.getTitle()
                + "\n\n## Abstract\n" + metadata.getSummary();

        LlmResponse response = ctx.getQueryAnalysisLlm().complete(
                List.of(Message.system(SYSTEM_PROMPT), Message.user(user)),
                CompletionOptions.builder().maxTokens(SCORE_MAX_TOKENS).temperature(0.0).build());
        ctx.getRunContext().addTokens(response.getPromptTokens(), response.getCompletionTokens());
        return response.getContent();
    }

    /** "85" → 0.85; the first number in the answer wins, capped at 100. */
    static OptionalDouble parseScore(String content) {
        if (content == null) {
            return OptionalDouble.empty();
        }
        Matcher m = SCORE.matcher(content);
        if (!m.find()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.min(100, Integer.parseInt(m.group())) / 100.0);
    }

    private static String format(double score) {
        return String.format(Locale.ROOT, "%.2f", score);
    }
}
