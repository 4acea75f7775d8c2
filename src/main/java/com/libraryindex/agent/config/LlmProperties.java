package com.libraryindex.agent.config;

import com.libraryindex.agent.llm.LlmProvider;
import com.libraryindex.agent.llm.LlmProviderProperties;
import com.libraryindex.agent.llm.LlmRole;
import com.libraryindex.agent.llm.ModelSelection;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

/**
 * Provider endpoints and per-role defaults, bound from the "llm" prefix.
 *
 * <pre>
 * llm:
 *   providers:
 *     groq: { api-key: ..., base-url: ..., model: ... }
 *   roles:
 *     query-analysis: { provider: groq }
 * </pre>
 */
@ConfigurationProperties(prefix = "llm")
@Data
public class LlmProperties {

    private Map<LlmProvider, LlmProviderProperties> providers = new EnumMap<>(LlmProvider.class);

    private Map<LlmRole, ModelSelection> roles = new EnumMap<>(LlmRole.class);

    /** Used for any role without an entry in {@link #roles}. */
    private LlmProvider defaultProvider = LlmProvider.GROQ;

    public ModelSelection selectionFor(LlmRole role) {
        ModelSelection configured = roles.get(role);
        return configured != null ? configured : new ModelSelection(defaultProvider, null);
    }
}
