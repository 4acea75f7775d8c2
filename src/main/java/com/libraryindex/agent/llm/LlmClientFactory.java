package com.libraryindex.agent.llm;

import com.libraryindex.agent.config.LlmProperties;
import com.libraryindex.agent.exception.LlmUnavailableException;
import com.libraryindex.agent.resilience.ResilientLlmClient;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves a {@link ModelSelection} to a resilient {@link LlmClient}.
 *
 * Providers are a closed enum; unknown names fail at config binding rather
 * than at call time. Clients are cached per provider/model pair so every
 * session shares one circuit breaker per provider.
 */
@Component
@Slf4j
public class LlmClientFactory {

    private static final String RESILIENCE_CONFIG = "llmClient";

    private final LlmProperties llmProperties;
    private final RestClient.Builder restClientBuilder;
    private final RetryRegistry retryRegistry;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final Map<String, LlmClient> clients = new ConcurrentHashMap<>();

    public LlmClientFactory(LlmProperties llmProperties,
                            RestClient.Builder restClientBuilder,
                            RetryRegistry retryRegistry,
                            CircuitBreakerRegistry circuitBreakerRegistry) {
        this.llmProperties = llmProperties;
        this.restClientBuilder = restClientBuilder;
        this.retryRegistry = retryRegistry;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    /**
     * Client for a role, honouring a per-request override when present.
     */
    public LlmClient forRole(LlmRole role, ModelSelection override) {
        ModelSelection selection = override != null && override.getProvider() != null
                ? override
                : llmProperties.selectionFor(role);
        LlmClient client = create(selection);
        log.info("  {} → {}", role, client.describe());
        return client;
    }

    public LlmClient create(ModelSelection selection) {
        LlmProvider provider = selection.getProvider();
        LlmProviderProperties base = llmProperties.getProviders().get(provider);
        if (base == null) {
            throw new LlmUnavailableException("No configuration for LLM provider " + provider
                    + " (llm.providers." + provider.name().toLowerCase() + ")");
        }
        LlmProviderProperties props = base.withModel(selection.getModel());

        return clients.computeIfAbsent(provider + "/" + props.getModel(), key -> {
            logKey(provider, props.getApiKey());
            LlmClient raw = new GenericLlmClient(props, provider, restClientBuilder.clone());
            String instance = "llm-" + provider.name().toLowerCase();
            return new ResilientLlmClient(raw,
                    retryRegistry.retry(instance, RESILIENCE_CONFIG),
                    circuitBreakerRegistry.circuitBreaker(instance, RESILIENCE_CONFIG));
        });
    }

    private void logKey(LlmProvider provider, String key) {
        if (key == null || key.isBlank()) {
            log.error("  {} API key not set! Set env var: {}={your-key}", provider, provider.apiKeyEnv());
        } else {
            log.info("  {} key: {}...{}", provider, key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
