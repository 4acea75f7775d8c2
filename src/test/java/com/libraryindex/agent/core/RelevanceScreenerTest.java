package com.libraryindex.agent.core;

import com.libraryindex.agent.exception.LlmTransientException;
import com.libraryindex.agent.exception.LlmUnavailableException;
import com.libraryindex.agent.llm.LlmClient;
import com.libraryindex.agent.model.LlmResponse;
import com.libraryindex.agent.search.PaperMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RelevanceScreenerTest {

    private static final PaperMetadata PAPER = PaperMetadata.builder()
            .id("2101.00001")
            .title("Message passing for molecules")
            .summary("We predict binding affinity with graph networks.")
            .build();

    @Mock LlmClient queryAnalysisLlm;

    private ResearchContext ctx;

    @BeforeEach
    void setUp() {
        ctx = ResearchContext.builder()
                .sessionId("screen-test")
                .query("graph neural networks for drug discovery")
                .maxWorkers(1)
                .queryAnalysisLlm(queryAnalysisLlm)
                .build();
    }

    @Test
    void screen_scoreBelowThreshold_returnsReason() {
        when(queryAnalysisLlm.complete(anyList(), any()))
                .thenReturn(LlmResponse.builder().content("12").promptTokens(80).completionTokens(1).build());

        assertThat(new RelevanceScreener(true, 0.3).screen(PAPER, ctx))
                .hasValue("below relevance threshold (0.12 < 0.30)");
        assertThat(ctx.getRunContext().totalTokens()).isEqualTo(81);
    }

    @Test
    void screen_scoreAtThreshold_passes() {
        when(queryAnalysisLlm.complete(anyList(), any())).thenReturn(LlmResponse.builder().content("30").build());

        assertThat(new RelevanceScreener(true, 0.3).screen(PAPER, ctx)).isEmpty();
    }

    @Test
    void screen_disabled_makesNoModelCall() {
        assertThat(new RelevanceScreener(false, 0.3).screen(PAPER, ctx)).isEmpty();
        verifyNoInteractions(queryAnalysisLlm);
    }

    @Test
    void screen_noAbstract_passesWithoutModelCall() {
        PaperMetadata bare = PaperMetadata.builder().id("2101.00002").title("Untitled").build();

        assertThat(new RelevanceScreener(true, 0.3).screen(bare, ctx)).isEmpty();
        verifyNoInteractions(queryAnalysisLlm);
    }

    @Test
    void screen_transientFailureOrUnreadableAnswer_passes() {
        RelevanceScreener screener = new RelevanceScreener(true, 0.3);
        when(queryAnalysisLlm.complete(anyList(), any()))
                .thenThrow(new LlmTransientException("503"))
                .thenReturn(LlmResponse.builder().content("quite relevant").build());

        assertThat(screener.screen(PAPER, ctx)).isEmpty();
        assertThat(screener.screen(PAPER, ctx)).isEmpty();
    }

    @Test
    void screen_permanentFailure_propagates() {
        when(queryAnalysisLlm.complete(anyList(), any())).thenThrow(new LlmUnavailableException("API key is invalid"));

        assertThatThrownBy(() -> new RelevanceScreener(true, 0.3).screen(PAPER, ctx))
                .isInstanceOf(LlmUnavailableException.class);
    }

    @Test
    void parseScore_readsFirstNumberAndCaps() {
        assertThat(RelevanceScreener.parseScore("Score: 85/100")).isEqualTo(OptionalDouble.of(0.85));
        assertThat(RelevanceScreener.parseScore("250")).isEqualTo(OptionalDouble.of(1.0));
        assertThat(RelevanceScreener.parseScore("none")).isEmpty();
        assertThat(RelevanceScreener.parseScore(null)).isEmpty();
    }
}
