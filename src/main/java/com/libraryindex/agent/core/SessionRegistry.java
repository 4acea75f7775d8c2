package com.libraryindex.agent.core;

import com.libraryindex.agent.exception.SessionConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Running sessions by id, so an external caller can request early termination.
 * Cancellation is honoured at the session's next barrier.
 */
@Component
@Slf4j
public class SessionRegistry {

    private final Map<String, ResearchContext> running = new ConcurrentHashMap<>();

    public void register(ResearchContext ctx) {
        if (running.putIfAbsent(ctx.getSessionId(), ctx) != null) {
            throw new SessionConflictException(ctx.getSessionId());
        }
    }

    public void unregister(ResearchContext ctx) {
        running.remove(ctx.getSessionId(), ctx);
    }

    /**
     * @return false when no session with that id is running
     */
    public boolean cancel(String sessionId) {
        ResearchContext ctx = running.get(sessionId);
        if (ctx == null) {
            return false;
        }
        ctx.requestCancellation();
        log.info("[session={}] Cancellation requested", sessionId);
        return true;
    }

    public boolean isRunning(String sessionId) {
        return running.containsKey(sessionId);
    }
}
