package com.libraryindex.agent.llm;

import com.libraryindex.agent.config.LlmProperties;
import com.libraryindex.agent.exception.LlmUnavailableException;
import com.libraryindex.agent.resilience.ResilientLlmClient;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmClientFactoryTest {

    private LlmProperties llmProperties;
    private CircuitBreakerRegistry circuitBreakerRegistry;
    private LlmClientFactory factory;

    @BeforeEach
    void setUp() {
        llmProperties = new LlmProperties();
        llmProperties.getProviders().put(LlmProvider.GROQ, provider("https://api.groq.com/openai/v1", "llama-3.3-70b-versatile"));
        llmProperties.getProviders().put(LlmProvider.DEEPSEEK, provider("https://api.deepseek.com/v1", "deepseek-chat"));
        llmProperties.setDefaultProvider(LlmProvider.GROQ);

        circuitBreakerRegistry = CircuitBreakerRegistry.of(Map.of("llmClient", CircuitBreakerConfig.ofDefaults()));
        factory = new LlmClientFactory(llmProperties, RestClient.builder(),
                RetryRegistry.of(Map.of("llmClient", RetryConfig.ofDefaults())),
                circuitBreakerRegistry);
    }

    @Test
    void forRole_noConfigOrOverride_usesDefaultProvider() {
        LlmClient client = factory.forRole(LlmRole.QUERY_ANALYSIS, null);

        assertThat(client).isInstanceOf(ResilientLlmClient.class);
        assertThat(client.describe()).isEqualTo("groq/llama-3.3-70b-versatile");
    }

    @Test
    void forRole_configuredRole_usesItsSelection() {
        llmProperties.getRoles().put(LlmRole.SYNTHESIS, new ModelSelection(LlmProvider.DEEPSEEK, null));

        assertThat(factory.forRole(LlmRole.SYNTHESIS, null).describe()).isEqualTo("deepseek/deepseek-chat");
    }

    @Test
    void forRole_requestOverride_winsOverConfiguration() {
        LlmClient client = factory.forRole(LlmRole.PAPER_ANALYSIS,
                new ModelSelection(LlmProvider.GROQ, "llama-3.1-8b-instant"));

        assertThat(client.describe()).isEqualTo("groq/llama-3.1-8b-instant");
    }

    @Test
    void create_sameSelection_reusesClient() {
        LlmClient first = factory.create(new ModelSelection(LlmProvider.GROQ, null));
        LlmClient second = factory.create(new ModelSelection(LlmProvider.GROQ, "llama-3.3-70b-versatile"));

        assertThat(second).isSameAs(first);
    }

    @Test
    void create_sharesOneCircuitBreakerPerProvider() {
        factory.create(new ModelSelection(LlmProvider.GROQ, null));
        factory.create(new ModelSelection(LlmProvider.GROQ, "llama-3.1-8b-instant"));

        assertThat(circuitBreakerRegistry.getAllCircuitBreakers())
                .extracting(cb -> cb.getName())
                .containsExactly("llm-groq");
    }

    @Test
    void create_unconfiguredProvider_isPermanentFailure() {
        assertThatThrownBy(() -> factory.create(new ModelSelection(LlmProvider.QWEN, null)))
                .isInstanceOf(LlmUnavailableException.class)
                .hasMessageContaining("llm.providers.qwen");
    }

    private static LlmProviderProperties provider(String baseUrl, String model) {
        LlmProviderProperties props = new LlmProviderProperties();
        props.setApiKey("test-key-123456789");
        props.setBaseUrl(baseUrl);
        props.setModel(model);
        return props;
    }
}
