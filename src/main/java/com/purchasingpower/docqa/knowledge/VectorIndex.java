package com.purchasingpower.docqa.knowledge;

import java.util.List;

/**
 * Similarity search over stored passages.
 *
 * Every search is keyed by a conversation id; passages of other conversations are
 * never candidates.
 *
 * @since 1.0.0
 */
public interface VectorIndex {

    /**
     * Find the passages of a conversation closest to the query vector.
     *
     * @param conversationId conversation to search in (required)
     * @param queryVector    embedding of the question
     * @param k              maximum number of passages; fewer are returned when fewer exist
     * @return passages ordered by score descending
     * @throws com.purchasingpower.docqa.exception.RetrievalException          if storage fails
     * @throws com.purchasingpower.docqa.exception.IsolationViolationException if a foreign passage shows up
     */
    RetrievalResult search(String conversationId, List<Double> queryVector, int k);

    /**
     * Like {@link #search(String, List, int)} but limited to some documents of the conversation.
     */
    RetrievalResult search(String conversationId, List<Double> queryVector, int k, List<Long> documentIds);

    /**
     * Number of passages stored for a conversation.
     */
    long countChunks(String conversationId);
}
