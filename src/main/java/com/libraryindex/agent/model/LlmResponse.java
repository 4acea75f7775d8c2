package com.libraryindex.agent.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LlmResponse {

    private String content;

    /** finish_reason as reported by the provider; "length" means the budget truncated the text */
    private String finishReason;

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;
}
