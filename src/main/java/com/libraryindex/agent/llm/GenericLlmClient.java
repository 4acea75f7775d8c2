package com.libraryindex.agent.llm;

import com.libraryindex.agent.exception.LlmRequestRejectedException;
import com.libraryindex.agent.exception.LlmTransientException;
import com.libraryindex.agent.exception.LlmUnavailableException;
import com.libraryindex.agent.model.LlmResponse;
import com.libraryindex.agent.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat-completions client for OpenAI, Groq, Gemini,
 * DeepSeek and Qwen (DashScope compatible mode).
 *
 * Error classification:
 *
 * | Error                      | Exception                      | Effect                      |
 * |----------------------------|--------------------------------|-----------------------------|
 * | 401 / 403                  | LlmUnavailableException        | session fails               |
 * | 404 / model_decommissioned | LlmUnavailableException        | session fails               |
 * | 429                        | LlmTransientException          | retried, counts toward CB   |
 * | other 4xx                  | LlmRequestRejectedException    | owning unit fails           |
 * | 5xx                        | LlmTransientException          | retried, counts toward CB   |
 * | network error              | LlmTransientException          | retried                     |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private final LlmProviderProperties props;
    private final LlmProvider provider;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderProperties props,
                            LlmProvider provider,
                            RestClient.Builder restClientBuilder) {
        this.props = props;
        this.provider = provider;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public LlmResponse complete(List<Message> messages, CompletionOptions options) {
        Map<String, Object> requestBody = buildRequestBody(messages, options);

        log.debug("Sending {} messages to {} [model={}, maxTokens={}]",
                messages.size(), provider, props.getModel(), requestBody.get("max_tokens"));

        try {
            Map<String, Object> response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 4xx [{}]: {}", provider, res.getStatusCode(), body);
                        handle4xxError(body, res.getStatusCode().value());
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 5xx [{}]: {}", provider, res.getStatusCode(), body);
                        throw new LlmTransientException(
                                provider + " server error [" + res.getStatusCode() + "]: " + body);
                    })
                    .body(new ParameterizedTypeReference<>() {});

            return parseResponse(response);

        } catch (ResourceAccessException e) {
            throw new LlmTransientException(provider + " unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return provider.name().toLowerCase() + "/" + props.getModel();
    }

    private void handle4xxError(String body, int statusCode) {
        if (body.contains("model_decommissioned") || statusCode == 404) {
            log.error("================================================================");
            log.error("  MODEL UNAVAILABLE: {} is not served by {}.", props.getModel(), provider);
            log.error("  Pick another model under llm.providers.{}.model", provider.name().toLowerCase());
            log.error("================================================================");
            throw new LlmUnavailableException(
                    "Model '" + props.getModel() + "' is not available from " + provider);
        }

        if (statusCode == 401 || statusCode == 403) {
            throw new LlmUnavailableException(
                    provider + " API key is invalid. Check your " + provider.apiKeyEnv()
                    + " environment variable.");
        }

        if (statusCode == 429) {
            throw new LlmTransientException(provider + " rate limit exceeded. Will retry.");
        }

        throw new LlmRequestRejectedException(provider + " client error [" + statusCode + "]: " + body);
    }

    private Map<String, Object> buildRequestBody(List<Message> messages, CompletionOptions options) {
        List<Map<String, Object>> formattedMessages = messages.stream()
                .map(this::formatMessage)
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", options.getMaxTokens() != null ? options.getMaxTokens() : props.getMaxTokens());
        body.put("temperature", options.getTemperature() != null ? options.getTemperature() : props.getTemperature());
        body.put("messages", formattedMessages);
        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());
        m.put("content", msg.getContent() != null ? msg.getContent() : "");
        return m;
    }

    @SuppressWarnings("unchecked")
    private LlmResponse parseResponse(Map<String, Object> response) {
        List<Map<String, Object>> choices = response == null ? null
                : (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new LlmTransientException(provider + " returned no choices in response");
        }

        int promptTokens = 0, completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens     = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
            log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);
        }

        Map<String, Object> choice       = choices.get(0);
        Map<String, Object> message      = (Map<String, Object>) choice.get("message");
        String              finishReason = (String) choice.get("finish_reason");

        log.debug("{} finish_reason: {}", provider, finishReason);

        return LlmResponse.builder()
                .content(message != null ? (String) message.get("content") : null)
                .finishReason(finishReason)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }
}
