package com.purchasingpower.docqa.knowledge.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.docqa.exception.IsolationViolationException;
import com.purchasingpower.docqa.exception.RetrievalException;
import com.purchasingpower.docqa.knowledge.RetrievalResult;
import com.purchasingpower.docqa.knowledge.ScoredChunk;
import com.purchasingpower.docqa.knowledge.VectorIndex;
import com.purchasingpower.docqa.model.document.DocumentChunk;
import com.purchasingpower.docqa.repository.DocumentChunkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Exact cosine-similarity search over the passages of one conversation.
 *
 * Candidates are loaded with the conversation id as the query key, then every
 * candidate is checked again before scoring. Scores are mapped from cosine
 * similarity [-1, 1] to [0, 1].
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationScopedVectorIndex implements VectorIndex {

    static final Comparator<ScoredChunk> RANKING = Comparator
            .comparingDouble(ScoredChunk::getScore).reversed()
            .thenComparingInt(s -> s.getChunk().getChunkIndex())
            .thenComparing(ScoredChunk::getDocumentId, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(s -> s.getChunk().getId(), Comparator.nullsLast(Comparator.naturalOrder()));

    private final DocumentChunkRepository chunkRepository;

    @Override
    public RetrievalResult search(String conversationId, List<Double> queryVector, int k) {
        return doSearch(conversationId, queryVector, k, null);
    }

    @Override
    public RetrievalResult search(String conversationId, List<Double> queryVector, int k, List<Long> documentIds) {
        Preconditions.checkArgument(documentIds != null, "documentIds is required");
        return doSearch(conversationId, queryVector, k, documentIds);
    }

    @Override
    public long countChunks(String conversationId) {
        Preconditions.checkArgument(conversationId != null && !conversationId.isBlank(),
                "conversationId is required for chunk lookups");
        try {
            return chunkRepository.countByConversationId(conversationId);
        } catch (DataAccessException e) {
            throw new RetrievalException(conversationId, "Failed to count passages: " + e.getMessage(), e);
        }
    }

    private RetrievalResult doSearch(String conversationId, List<Double> queryVector, int k, List<Long> documentIds) {
        Preconditions.checkArgument(conversationId != null && !conversationId.isBlank(),
                "conversationId is required for vector search");
        Preconditions.checkArgument(queryVector != null && !queryVector.isEmpty(), "queryVector is required");

        if (k <= 0 || (documentIds != null && documentIds.isEmpty())) {
            return RetrievalResult.empty(conversationId);
        }

        List<DocumentChunk> candidates;
        try {
            candidates = documentIds == null
                    ? chunkRepository.findByConversationId(conversationId)
                    : chunkRepository.findByConversationIdAndDocumentIds(conversationId, documentIds);
        } catch (DataAccessException e) {
            log.error("❌ Vector search failed for conversation {}: {}", conversationId, e.getMessage());
            throw new RetrievalException(conversationId, "Failed to load passages: " + e.getMessage(), e);
        }

        List<ScoredChunk> scored = new ArrayList<>(candidates.size());
        int skipped = 0;
        for (DocumentChunk chunk : candidates) {
            if (!Objects.equals(chunk.getConversationId(), conversationId)) {
                log.error("🚨 ISOLATION VIOLATION: chunk {} of conversation {} returned for conversation {}",
                        chunk.getId(), chunk.getConversationId(), conversationId);
                throw new IsolationViolationException(conversationId, chunk.getConversationId(), chunk.getId());
            }
            List<Double> embedding = chunk.getEmbedding();
            if (embedding == null || embedding.size() != queryVector.size()) {
                skipped++;
                continue;
            }
            scored.add(new ScoredChunk(chunk, toUnitScore(cosineSimilarity(queryVector, embedding))));
        }

        if (skipped > 0) {
            log.warn("⚠️ Skipped {} passages of conversation {} with a dimension other than {}",
                    skipped, conversationId, queryVector.size());
        }

        scored.sort(RANKING);
        int effectiveK = Math.min(k, scored.size());
        List<ScoredChunk> top = List.copyOf(scored.subList(0, effectiveK));

        log.debug("🔍 Conversation {}: {} candidates, returning top {}", conversationId, candidates.size(), top.size());
        return new RetrievalResult(conversationId, top, candidates.size());
    }

    static double cosineSimilarity(List<Double> a, List<Double> b) {
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    static double toUnitScore(double cosine) {
        double score = (1.0 + cosine) / 2.0;
        return Math.max(0.0, Math.min(1.0, score));
    }
}
