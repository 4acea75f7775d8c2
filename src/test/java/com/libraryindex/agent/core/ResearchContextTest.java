package com.libraryindex.agent.core;

import com.libraryindex.agent.llm.LlmProvider;
import com.libraryindex.agent.llm.LlmRole;
import com.libraryindex.agent.llm.ModelSelection;
import com.libraryindex.agent.search.PaperMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResearchContextTest {

    private ResearchContext ctx;

    @BeforeEach
    void setUp() {
        ctx = ResearchContext.builder()
                .sessionId("s-1")
                .query("graph neural networks for drug discovery")
                .maxWorkers(4)
                .maxSearchRetries(2)
                .modelOverride(LlmRole.SYNTHESIS, new ModelSelection(LlmProvider.DEEPSEEK, "deepseek-chat"))
                .modelOverride(LlmRole.PAPER_ANALYSIS, null)
                .build();
    }

    @Test
    void newContext_startsInitializingWithDefaults() {
        assertThat(ctx.getState()).isEqualTo(ResearchState.INITIALIZING);
        assertThat(ctx.getSearchAttempts()).isZero();
        assertThat(ctx.getHistory()).isEmpty();
        assertThat(ctx.getRefinementHints()).isEqualTo(RefinementHints.NONE);
        assertThat(ctx.getRunContext()).isNotNull();
    }

    @Test
    void modelOverride_nullSelectionsAreDropped() {
        assertThat(ctx.modelOverride(LlmRole.SYNTHESIS).getProvider()).isEqualTo(LlmProvider.DEEPSEEK);
        assertThat(ctx.modelOverride(LlmRole.PAPER_ANALYSIS)).isNull();
        assertThat(ctx.modelOverride(LlmRole.QUERY_ANALYSIS)).isNull();
    }

    @Test
    void transitionTo_recordsTheStateBeingLeft() {
        ctx.transitionTo(ResearchState.ANALYZING_QUERY, "ready");
        ctx.transitionTo(ResearchState.PLANNING_SEARCH, "keywords: gnn");

        assertThat(ctx.getState()).isEqualTo(ResearchState.PLANNING_SEARCH);
        assertThat(ctx.getHistory()).extracting(HistoryEntry::getState)
                .containsExactly(ResearchState.INITIALIZING, ResearchState.ANALYZING_QUERY);
        assertThat(ctx.getHistory().get(1).getSummary()).isEqualTo("keywords: gnn");
    }

    @Test
    void transitionTo_fromTerminalState_throws() {
        ctx.transitionTo(ResearchState.FAILED, "cache down");

        assertThatThrownBy(() -> ctx.transitionTo(ResearchState.ANALYZING_QUERY, "again"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("FAILED");
    }

    @Test
    void getHistory_isReadOnly() {
        ctx.record("note");

        assertThatThrownBy(() -> ctx.getHistory().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void issuedQueries_collectsQueriesAcrossHistory() {
        ctx.transitionTo(ResearchState.ANALYZING_QUERY, "ready");
        ctx.transitionTo(ResearchState.PLANNING_SEARCH, "kw");
        ctx.transitionTo(ResearchState.EXECUTING_SEARCH, "planned");
        ctx.transitionTo(ResearchState.PROCESSING_RESULTS, "searched", List.of("all:gnn", "ti:graph"));
        ctx.record(HistoryEntry.builder().state(ResearchState.EXECUTING_SEARCH).summary("retry")
                .query("all:gnn").query("abs:drug").build());

        assertThat(ctx.issuedQueries()).containsExactly("all:gnn", "ti:graph", "abs:drug");
    }

    @Test
    void incrementSearchAttempts_stopsAtCeiling() {
        ctx.incrementSearchAttempts();
        ctx.incrementSearchAttempts();

        assertThat(ctx.canRefine()).isFalse();
        assertThatThrownBy(ctx::incrementSearchAttempts).isInstanceOf(IllegalStateException.class);
        assertThat(ctx.getSearchAttempts()).isEqualTo(2);
    }

    @Test
    void addCandidate_sameIdTwice_keepsOneRecordAndMergesMetadata() {
        assertThat(ctx.addCandidate(PaperMetadata.builder().id("2101.00001").title("A").build())).isTrue();
        assertThat(ctx.addCandidate(PaperMetadata.builder().id("2101.00001").summary("abstract").build())).isFalse();

        assertThat(ctx.getCandidatePapers()).hasSize(1);
        PaperRecord paper = ctx.getCandidatePapers().get("2101.00001");
        assertThat(paper.getMetadata().getTitle()).isEqualTo("A");
        assertThat(paper.getMetadata().getSummary()).isEqualTo("abstract");
    }

    @Test
    void addCandidate_withoutId_isRejected() {
        assertThat(ctx.addCandidate(PaperMetadata.builder().title("no id").build())).isFalse();
        assertThat(ctx.addCandidate(null)).isFalse();
        assertThat(ctx.getCandidatePapers()).isEmpty();
    }

    @Test
    void pendingPapers_excludesSettledRecords() {
        ctx.addCandidate(PaperMetadata.builder().id("a").build());
        ctx.addCandidate(PaperMetadata.builder().id("b").build());
        ctx.getCandidatePapers().get("a").markAnalyzed("done", true);

        assertThat(ctx.pendingPapers()).extracting(PaperRecord::getId).containsExactly("b");
        assertThat(ctx.countPapers(PaperStatus.ANALYZED)).isEqualTo(1);
    }

    @Test
    void drainPartialResults_returnsAllAndEmptiesBuffer() {
        ctx.addPartialResult("one");
        ctx.addPartialResult("two");

        assertThat(ctx.drainPartialResults()).containsExactly("one", "two");
        assertThat(ctx.getPartialResults()).isEmpty();
    }

    @Test
    void requestCancellation_isVisible() {
        assertThat(ctx.isCancellationRequested()).isFalse();
        ctx.requestCancellation();
        assertThat(ctx.isCancellationRequested()).isTrue();
    }
}
