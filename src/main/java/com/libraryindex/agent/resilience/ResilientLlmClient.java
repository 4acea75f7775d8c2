package com.libraryindex.agent.resilience;

import com.libraryindex.agent.exception.LlmTransientException;
import com.libraryindex.agent.llm.CompletionOptions;
import com.libraryindex.agent.llm.LlmClient;
import com.libraryindex.agent.model.LlmResponse;
import com.libraryindex.agent.model.Message;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Supplier;

/**
 * Decorator around a provider client that adds retry + circuit breaker.
 *
 * Clients are built per (provider, model) at runtime, so the decoration is
 * programmatic rather than annotation-driven. Instances come from the shared
 * registries and use the "llmClient" config in application.yml:
 * - Retry: 3 attempts, exponential backoff 2s → 4s, only on LlmTransientException
 * - Circuit breaker: opens at 50% failures over 10 calls, half-open after 30s.
 *   Permanent and rejected-request failures are ignored by both.
 *
 * There is no fallback response; failures propagate typed.
 */
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;

    public ResilientLlmClient(LlmClient delegate, Retry retry, CircuitBreaker circuitBreaker) {
        this.delegate = delegate;
        this.retry = retry;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public LlmResponse complete(List<Message> messages, CompletionOptions options) {
        Supplier<LlmResponse> guarded = CircuitBreaker.decorateSupplier(
                circuitBreaker, () -> delegate.complete(messages, options));
        try {
            return Retry.decorateSupplier(retry, guarded).get();
        } catch (CallNotPermittedException e) {
            log.error("LLM circuit breaker [{}] is OPEN, rejecting call to {}",
                    circuitBreaker.getName(), delegate.describe());
            throw new LlmTransientException(
                    "Circuit open for " + delegate.describe() + "; try again in about 30 seconds", e);
        }
    }

    @Override
    public String describe() {
        return delegate.describe();
    }
}
