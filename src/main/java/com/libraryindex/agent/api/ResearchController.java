package com.libraryindex.agent.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libraryindex.agent.core.ResearchOrchestrator;
import com.libraryindex.agent.core.SessionRegistry;
import com.libraryindex.agent.model.ResearchRequest;
import com.libraryindex.agent.model.ResearchResponse;
import com.libraryindex.agent.resilience.IdempotencyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Research endpoints.
 *
 * POST /api/v1/research/run
 *   Optional header: Idempotency-Key: <uuid>
 *   A repeated key within 24h returns the cached response; a key still in
 *   flight gets 409.
 *
 * POST /api/v1/research/{sessionId}/cancel
 * GET  /api/v1/research/health
 */
@RestController
@RequestMapping("/api/v1/research")
@RequiredArgsConstructor
@Slf4j
public class ResearchController {

    private final ResearchOrchestrator orchestrator;
    private final SessionRegistry sessionRegistry;
    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;

    @PostMapping("/run")
    public ResponseEntity<?> run(
            @Valid @RequestBody ResearchRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        log.info("Research run request [sessionId={}, idempotencyKey={}]", request.getSessionId(), idempotencyKey);

        boolean idempotent = idempotencyKey != null && !idempotencyKey.isBlank();
        if (idempotent) {
            var cached = idempotencyService.getCachedResponse(idempotencyKey);
            if (cached.isPresent()) {
                try {
                    return ResponseEntity.ok(objectMapper.readValue(cached.get(), ResearchResponse.class));
                } catch (Exception e) {
                    log.warn("Failed to deserialize cached response, running fresh", e);
                    idempotencyService.releaseKey(idempotencyKey);
                }
            }
            if (!idempotencyService.claimKey(idempotencyKey)) {
                return ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(Map.of("error", "A request with this Idempotency-Key is in progress"));
            }
        }

        ResearchResponse response;
        try {
            response = orchestrator.run(request);
        } catch (RuntimeException e) {
            if (idempotent) {
                idempotencyService.releaseKey(idempotencyKey);
            }
            throw e;
        }

        if (idempotent) {
            try {
                idempotencyService.storeResponse(idempotencyKey, objectMapper.writeValueAsString(response));
            } catch (Exception e) {
                log.warn("Failed to cache idempotency response", e);
                idempotencyService.releaseKey(idempotencyKey);
            }
        }
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{sessionId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String sessionId) {
        boolean cancelled = sessionRegistry.cancel(sessionId);
        if (!cancelled) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("sessionId", sessionId, "cancelled", false));
        }
        return ResponseEntity.accepted().body(Map.of("sessionId", sessionId, "cancelled", true));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
