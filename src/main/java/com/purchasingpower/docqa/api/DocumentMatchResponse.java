package com.purchasingpower.docqa.api;

import com.purchasingpower.docqa.model.document.DocumentMatch;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentMatchResponse {

    private Long id;
    private Long messageId;
    private Long documentId;
    private String filename;
    private String matchedContent;
    private double relevanceScore;
    private LocalDateTime createdAt;

    public static DocumentMatchResponse from(DocumentMatch match) {
        return DocumentMatchResponse.builder()
            .id(match.getId())
            .messageId(match.getMessageId())
            .documentId(match.getDocumentId())
            .filename(match.getDocument().getFilename())
            .matchedContent(match.getMatchedContent())
            .relevanceScore(match.getRelevanceScore())
            .createdAt(match.getCreatedAt())
            .build();
    }
}
