package com.libraryindex.agent.llm;

import lombok.Data;

/**
 * Holds config for a single LLM provider.
 * Populated from application.yml under llm.providers.{provider}.
 */
@Data
public class LlmProviderProperties {
    private String apiKey = "";
    private String baseUrl;
    private String model;
    private int maxTokens = 2048;
    private double temperature = 0.7;

    public LlmProviderProperties withModel(String overrideModel) {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(apiKey);
        p.setBaseUrl(baseUrl);
        p.setModel(overrideModel != null && !overrideModel.isBlank() ? overrideModel : model);
        p.setMaxTokens(maxTokens);
        p.setTemperature(temperature);
        return p;
    }
}
