/**
 * Knowledge management: passage splitting, embeddings and conversation-scoped vector search.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code TextChunker} - splits document text into overlapping passages</li>
 *   <li>{@code EmbeddingService} - turns text into vectors through the configured provider</li>
 *   <li>{@code VectorIndex} - similarity search restricted to one conversation</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.docqa.knowledge;
