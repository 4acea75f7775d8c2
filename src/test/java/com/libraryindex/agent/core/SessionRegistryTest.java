package com.libraryindex.agent.core;

import com.libraryindex.agent.exception.SessionConflictException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRegistryTest {

    private final SessionRegistry registry = new SessionRegistry();

    @Test
    void register_sameIdTwice_conflicts() {
        registry.register(context("s-1"));

        assertThatThrownBy(() -> registry.register(context("s-1")))
                .isInstanceOf(SessionConflictException.class)
                .hasMessageContaining("s-1");
    }

    @Test
    void cancel_runningSession_flagsContext() {
        ResearchContext ctx = context("s-2");
        registry.register(ctx);

        assertThat(registry.cancel("s-2")).isTrue();
        assertThat(ctx.isCancellationRequested()).isTrue();
    }

    @Test
    void cancel_unknownSession_returnsFalse() {
        assertThat(registry.cancel("missing")).isFalse();
    }

    @Test
    void unregister_freesTheId() {
        ResearchContext ctx = context("s-3");
        registry.register(ctx);
        registry.unregister(ctx);

        assertThat(registry.isRunning("s-3")).isFalse();
        registry.register(context("s-3"));
        assertThat(registry.isRunning("s-3")).isTrue();
    }

    @Test
    void unregister_otherContextWithSameId_leavesRunningOneRegistered() {
        ResearchContext running = context("s-4");
        registry.register(running);

        registry.unregister(context("s-4"));

        assertThat(registry.isRunning("s-4")).isTrue();
    }

    private static ResearchContext context(String sessionId) {
        return ResearchContext.builder()
                .sessionId(sessionId)
                .query("q")
                .maxWorkers(1)
                .maxSearchRetries(0)
                .build();
    }
}
