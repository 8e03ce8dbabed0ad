package com.purchasingpower.docqa.knowledge;

import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Passages returned by one search, best first.
 */
@Value
public class RetrievalResult {
    String conversationId;
    List<ScoredChunk> chunks;
    int candidateCount;

    public static RetrievalResult empty(String conversationId) {
        return new RetrievalResult(conversationId, List.of(), 0);
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public int size() {
        return chunks.size();
    }

    public long distinctDocumentCount() {
        return chunks.stream()
                .map(ScoredChunk::getDocumentId)
                .filter(Objects::nonNull)
                .distinct()
                .count();
    }

    /**
     * Same result without passages scoring below {@code minScore}.
     */
    public RetrievalResult withMinScore(double minScore) {
        return new RetrievalResult(conversationId,
                chunks.stream().filter(c -> c.getScore() >= minScore).toList(),
                candidateCount);
    }
}
