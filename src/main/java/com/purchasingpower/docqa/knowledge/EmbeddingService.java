package com.purchasingpower.docqa.knowledge;

import java.util.List;

/**
 * Service for generating embeddings for passages and questions.
 *
 * Implementations retry transient provider failures and report exhaustion as a
 * {@link com.purchasingpower.docqa.exception.ProviderException}.
 *
 * @since 1.0.0
 */
public interface EmbeddingService {

    /**
     * Generate an embedding for arbitrary text.
     *
     * @param text the text to embed
     * @return embedding vector
     */
    List<Double> embed(String text);
}
