package com.libraryindex.agent.api;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.libraryindex.agent.core.ResearchContext;
import com.libraryindex.agent.core.ResearchOrchestrator;
import com.libraryindex.agent.core.ResearchState;
import com.libraryindex.agent.core.SessionRegistry;
import com.libraryindex.agent.exception.LlmUnavailableException;
import com.libraryindex.agent.model.ResearchRequest;
import com.libraryindex.agent.model.ResearchResponse;
import com.libraryindex.agent.resilience.IdempotencyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResearchControllerTest {

    @Mock ResearchOrchestrator orchestrator;
    @Mock IdempotencyService idempotencyService;

    private SessionRegistry sessionRegistry;
    private ObjectMapper objectMapper;
    private ResearchController controller;

    @BeforeEach
    void setUp() {
        sessionRegistry = new SessionRegistry();
        objectMapper = new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        controller = new ResearchController(orchestrator, sessionRegistry, idempotencyService, objectMapper);
    }

    @Test
    void run_withoutKey_runsOnce() {
        ResearchResponse completed = completed("s-1");
        when(orchestrator.run(any())).thenReturn(completed);

        ResponseEntity<?> response = controller.run(request(), null);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(completed);
        verifyNoInteractions(idempotencyService);
    }

    @Test
    void run_newKey_claimsRunsAndStores() {
        when(idempotencyService.getCachedResponse("k")).thenReturn(Optional.empty());
        when(idempotencyService.claimKey("k")).thenReturn(true);
        when(orchestrator.run(any())).thenReturn(completed("s-2"));

        controller.run(request(), "k");

        verify(idempotencyService).storeResponse(eq("k"), contains("\"sessionId\":\"s-2\""));
    }

    @Test
    void run_cachedKey_returnsStoredResponseWithoutRunning() throws Exception {
        String json = objectMapper.writeValueAsString(completed("s-3"));
        when(idempotencyService.getCachedResponse("k")).thenReturn(Optional.of(json));

        ResponseEntity<?> response = controller.run(request(), "k");

        assertThat(((ResearchResponse) response.getBody()).getSessionId()).isEqualTo("s-3");
        verifyNoInteractions(orchestrator);
    }

    @Test
    void run_keyInFlight_isConflict() {
        when(idempotencyService.getCachedResponse("k")).thenReturn(Optional.empty());
        when(idempotencyService.claimKey("k")).thenReturn(false);

        ResponseEntity<?> response = controller.run(request(), "k");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        verifyNoInteractions(orchestrator);
    }

    @Test
    void run_unexpectedError_releasesKey() {
        when(idempotencyService.getCachedResponse("k")).thenReturn(Optional.empty());
        when(idempotencyService.claimKey("k")).thenReturn(true);
        when(orchestrator.run(any())).thenThrow(new LlmUnavailableException("no provider"));

        assertThatThrownBy(() -> controller.run(request(), "k")).isInstanceOf(LlmUnavailableException.class);
        verify(idempotencyService).releaseKey("k");
    }

    @Test
    void cancel_runningSession_isAccepted() {
        ResearchContext ctx = ResearchContext.builder().sessionId("s-4").query("q").maxWorkers(1).build();
        sessionRegistry.register(ctx);

        assertThat(controller.cancel("s-4").getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(ctx.isCancellationRequested()).isTrue();
    }

    @Test
    void cancel_unknownSession_isNotFound() {
        assertThat(controller.cancel("nope").getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    private static ResearchRequest request() {
        return ResearchRequest.builder().query("graph neural networks for drug discovery").build();
    }

    private static ResearchResponse completed(String sessionId) {
        return ResearchResponse.builder()
                .sessionId(sessionId)
                .finalState(ResearchState.COMPLETED)
                .report("# Research report")
                .build();
    }
}
