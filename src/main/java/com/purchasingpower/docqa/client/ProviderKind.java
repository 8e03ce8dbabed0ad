package com.purchasingpower.docqa.client;

/**
 * The fixed set of model backends. Selected through {@code app.llm.provider}
 * and {@code app.llm.embedding-provider}.
 */
public enum ProviderKind {

    /**
     * Self-hosted Ollama server.
     */
    LOCAL,

    /**
     * Google Gemini API.
     */
    HOSTED,

    /**
     * OpenAI-compatible gateway (OpenRouter and similar).
     */
    GATEWAY
}
