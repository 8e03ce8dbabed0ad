package com.purchasingpower.docqa.model.document;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Full text of a document together with how it has been used in answers.
 */
@Value
@Builder
public class DocumentPreview {
    Long documentId;
    String conversationId;
    String filename;
    IngestionStatus status;
    int chunkCount;
    String content;
    LocalDateTime createdAt;
    long usageCount;
    List<MatchPreview> recentMatches;

    @Value
    @Builder
    public static class MatchPreview {
        Long messageId;
        String messageExcerpt;
        String matchedExcerpt;
        double relevanceScore;
        LocalDateTime matchedAt;
    }
}
