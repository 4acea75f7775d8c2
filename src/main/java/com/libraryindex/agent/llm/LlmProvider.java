package com.libraryindex.agent.llm;

/**
 * Supported OpenAI-compatible chat providers. Each constant names the
 * environment variable holding its key, for startup diagnostics.
 */
public enum LlmProvider {
    OPENAI("OPENAI_API_KEY"),
    GROQ("GROQ_API_KEY"),
    GEMINI("GEMINI_API_KEY"),
    DEEPSEEK("DEEPSEEK_API_KEY"),
    QWEN("QWEN_API_KEY");

    private final String apiKeyEnv;

    LlmProvider(String apiKeyEnv) {
        this.apiKeyEnv = apiKeyEnv;
    }

    public String apiKeyEnv() {
        return apiKeyEnv;
    }
}
