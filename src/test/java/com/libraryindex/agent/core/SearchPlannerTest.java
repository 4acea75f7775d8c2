package com.libraryindex.agent.core;

import com.libraryindex.agent.config.ResearchProperties;
import com.libraryindex.agent.llm.LlmClient;
import com.libraryindex.agent.search.ArxivQueryGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SearchPlannerTest {

    @Mock ArxivQueryGenerator queryGenerator;
    @Mock LlmClient llm;

    private SearchPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new SearchPlanner(queryGenerator, new ResearchProperties());
    }

    @Test
    void plan_dropsQueriesAlreadyInHistory() {
        when(queryGenerator.generate(eq(llm), eq("gnn"), any())).thenReturn(List.of("all:gnn", "ti:graph"));
        List<HistoryEntry> history = List.of(searched("all:gnn"));

        assertThat(planner.plan(llm, "gnn", RefinementHints.NONE, history)).containsExactly("ti:graph");
    }

    @Test
    void plan_everythingTried_fallsBackToUntriedKeywordQuery() {
        String keywords = "graph neural networks, drug discovery";
        when(queryGenerator.generate(eq(llm), eq(keywords), any())).thenReturn(List.of("all:gnn"));

        List<String> planned = planner.plan(llm, keywords, RefinementHints.NONE, List.of(searched("all:gnn")));

        assertThat(planned).containsExactly("all:graph+neural+networks+drug+discovery");
    }

    @Test
    void plan_fallbackSkipsTriedPhrases() {
        String keywords = "graph neural networks, drug discovery";
        when(queryGenerator.generate(eq(llm), eq(keywords), any())).thenReturn(List.of("all:gnn"));
        List<HistoryEntry> history = List.of(
                searched("all:gnn"),
                searched("all:graph+neural+networks+drug+discovery"));

        assertThat(planner.plan(llm, keywords, RefinementHints.NONE, history))
                .containsExactly("all:graph+neural+networks");
    }

    @Test
    void plan_passesRefinementHintsToGenerator() {
        RefinementHints hints = RefinementHints.builder()
                .action(QualityEvaluation.SuggestedAction.EXPAND_KEYWORDS)
                .build();
        when(queryGenerator.generate(eq(llm), eq("gnn"), contains("broader"))).thenReturn(List.of("all:graph"));

        assertThat(planner.plan(llm, "gnn", hints, List.of())).containsExactly("all:graph");
    }

    @Test
    void keywordFallbacks_orderWholeThenPhrasesThenWords() {
        assertThat(SearchPlanner.keywordFallbacks("graph networks, drug"))
                .containsExactly(
                        "all:graph+networks+drug",
                        "all:graph+networks",
                        "all:drug",
                        "all:graph",
                        "all:networks");
    }

    @Test
    void score_isAnalyzedOverFound() {
        assertThat(planner.score(0, 0)).isZero();
        assertThat(planner.score(4, 2)).isEqualTo(0.5);
        assertThat(planner.score(4, 4)).isEqualTo(1.0);
    }

    @Test
    void evaluate_nothingFound_suggestsExpand() {
        QualityEvaluation evaluation = planner.evaluate(metrics(0, 0), 1);

        assertThat(evaluation.getSuggestedAction()).isEqualTo(QualityEvaluation.SuggestedAction.EXPAND_KEYWORDS);
        assertThat(evaluation.isInsufficient()).isTrue();
    }

    @Test
    void evaluate_lowSuccessRate_suggestsRefine() {
        QualityEvaluation evaluation = planner.evaluate(metrics(10, 2), 1);

        assertThat(evaluation.getSuggestedAction()).isEqualTo(QualityEvaluation.SuggestedAction.REFINE_KEYWORDS);
        assertThat(evaluation.getSuccessRate()).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void evaluate_fewPapers_suggestsBroaden() {
        QualityEvaluation evaluation = planner.evaluate(metrics(2, 2), 1);

        assertThat(evaluation.getSuggestedAction()).isEqualTo(QualityEvaluation.SuggestedAction.BROADEN_SEARCH);
    }

    @Test
    void evaluate_enoughGoodPapers_continues() {
        QualityEvaluation evaluation = planner.evaluate(metrics(6, 5), 2);

        assertThat(evaluation.getSuggestedAction()).isEqualTo(QualityEvaluation.SuggestedAction.CONTINUE);
        assertThat(evaluation.isInsufficient()).isFalse();
        assertThat(evaluation.getSearchEfficiency()).isEqualTo(3.0);
    }

    private static HistoryEntry searched(String query) {
        return HistoryEntry.builder().state(ResearchState.EXECUTING_SEARCH).summary("searched").query(query).build();
    }

    private static QualityMetrics metrics(int found, int analyzed) {
        QualityMetrics metrics = new QualityMetrics();
        metrics.setPapersFound(found);
        metrics.setPapersAnalyzed(analyzed);
        return metrics;
    }
}
