package com.libraryindex.agent.llm;

import lombok.Builder;
import lombok.Value;

/**
 * Per-call overrides. Null fields use the provider's configured values.
 */
@Value
@Builder
public class CompletionOptions {

    public static final CompletionOptions DEFAULTS = CompletionOptions.builder().build();

    Integer maxTokens;
    Double temperature;

    public static CompletionOptions temperature(double temperature) {
        return CompletionOptions.builder().temperature(temperature).build();
    }
}
