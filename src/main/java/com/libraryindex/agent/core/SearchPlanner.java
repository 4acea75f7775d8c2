package com.libraryindex.agent.core;

import com.libraryindex.agent.config.ResearchProperties;
import com.libraryindex.agent.llm.LlmClient;
import com.libraryindex.agent.search.ArxivQueryGenerator;
import com.libraryindex.agent.search.ArxivQuerySyntax;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Produces search expressions for a round and scores the round's yield.
 *
 * {@link #plan} never returns an expression already present in the session
 * history. When every generated expression has been tried, it falls back to
 * one {@code all:} query per keyword phrase and then per word, so a refinement
 * round still searches something new while untried terms remain.
 */
@Component
@Slf4j
public class SearchPlanner {

    private final ArxivQueryGenerator queryGenerator;
    private final ResearchProperties.Orchestration thresholds;

    public SearchPlanner(ArxivQueryGenerator queryGenerator, ResearchProperties properties) {
        this.queryGenerator = queryGenerator;
        this.thresholds = properties.getOrchestration();
    }

    public List<String> plan(LlmClient llm, String keywords, RefinementHints hints,
                             Collection<HistoryEntry> history) {
        Set<String> tried = new LinkedHashSet<>();
        history.forEach(entry -> tried.addAll(entry.getQueries()));

        Set<String> fresh = new LinkedHashSet<>();
        for (String q : queryGenerator.generate(llm, keywords, hints == null ? null : hints.describe())) {
            if (!tried.contains(q)) fresh.add(q);
        }

        if (fresh.isEmpty()) {
            for (String q : keywordFallbacks(keywords)) {
                if (!tried.contains(q)) {
                    fresh.add(q);
                    break;
                }
            }
        }

        if (fresh.isEmpty()) {
            log.warn("Planner has no untried query for keywords '{}'", keywords);
        }
        return new ArrayList<>(fresh);
    }

    /** Analysis success ratio in [0, 1]; 0 when nothing was found. */
    public double score(int papersFound, int papersAnalyzed) {
        if (papersFound <= 0) return 0.0;
        return Math.min(1.0, (double) papersAnalyzed / papersFound);
    }

    public QualityEvaluation evaluate(QualityMetrics metrics, int searchRounds) {
        int found = metrics.getPapersFound();
        double rate = score(found, metrics.getPapersAnalyzed());

        QualityEvaluation.SuggestedAction action;
        if (found == 0) {
            action = QualityEvaluation.SuggestedAction.EXPAND_KEYWORDS;
        } else if (rate < thresholds.getMinSuccessRate()) {
            action = QualityEvaluation.SuggestedAction.REFINE_KEYWORDS;
        } else if (found < thresholds.getMinSearchResults()) {
            action = QualityEvaluation.SuggestedAction.BROADEN_SEARCH;
        } else {
            action = QualityEvaluation.SuggestedAction.CONTINUE;
        }

        return QualityEvaluation.builder()
                .papersFound(found)
                .papersAnalyzed(metrics.getPapersAnalyzed())
                .successRate(rate)
                .searchEfficiency((double) found / Math.max(1, searchRounds))
                .suggestedAction(action)
                .build();
    }

    static List<String> keywordFallbacks(String keywords) {
        Set<String> out = new LinkedHashSet<>();
        if (keywords == null) return List.of();

        String whole = ArxivQuerySyntax.fallbackQuery(keywords.replaceAll("[,.;\\n]", " "));
        if (whole != null) out.add(whole);

        for (String phrase : keywords.split("[,.;\\n]")) {
            String q = ArxivQuerySyntax.fallbackQuery(phrase);
            if (q != null) out.add(q);
        }
        for (String word : keywords.split("[\\s,.;]+")) {
            if (word.length() < 3) continue;
            String q = ArxivQuerySyntax.fallbackQuery(word);
            if (q != null) out.add(q);
        }
        return new ArrayList<>(out);
    }
}
