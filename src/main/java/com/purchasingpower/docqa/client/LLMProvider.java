package com.purchasingpower.docqa.client;

import com.purchasingpower.docqa.model.conversation.MemoryTurn;

import java.util.List;

/**
 * Unified interface for model providers (Ollama, Gemini, OpenAI-compatible gateways).
 *
 * Provides answer generation and embedding generation.
 * Implementations handle provider-specific API details and report failures as
 * {@link com.purchasingpower.docqa.exception.ProviderException}. They do not retry;
 * retries and timeouts are applied by the caller.
 *
 * @since 1.0.0
 */
public interface LLMProvider {

    /**
     * Which configured variant this is.
     */
    ProviderKind getKind();

    /**
     * Generate a completion for the prompt, with prior dialogue turns as context.
     *
     * @param prompt  fully rendered prompt for the current question
     * @param history earlier turns, oldest first (may be empty)
     * @return generated text
     */
    String generate(String prompt, List<MemoryTurn> history);

    /**
     * Generate an embedding vector for a single text.
     *
     * @param text text to embed
     * @return embedding vector (dimension is fixed per model)
     */
    List<Double> embed(String text);

    /**
     * Get the provider name (for logging).
     */
    String getProviderName();
}
