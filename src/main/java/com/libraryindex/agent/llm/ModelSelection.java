package com.libraryindex.agent.llm;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Provider + model chosen for one {@link LlmRole}.
 * A null model means "the provider's configured default".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModelSelection {
    private LlmProvider provider;
    private String model;
}
