package com.libraryindex.agent.api;

import com.libraryindex.agent.observability.ResearchRunTrace;
import com.libraryindex.agent.observability.TraceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * GET /api/v1/observability/traces/session/{sessionId}   traces of one session
 * GET /api/v1/observability/analytics                    latency, tokens, success rate, terminal states
 */
@RestController
@RequestMapping("/api/v1/observability")
@RequiredArgsConstructor
public class ObservabilityController {

    private final TraceService traceService;

    @GetMapping("/traces/session/{sessionId}")
    public ResponseEntity<List<ResearchRunTrace>> getSessionTraces(@PathVariable String sessionId) {
        return ResponseEntity.ok(traceService.getTracesForSession(sessionId));
    }

    @GetMapping("/analytics")
    public ResponseEntity<Map<String, Object>> getAnalytics() {
        return ResponseEntity.ok(traceService.getAnalytics());
    }
}
