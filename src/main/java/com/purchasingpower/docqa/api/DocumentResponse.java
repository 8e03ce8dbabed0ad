package com.purchasingpower.docqa.api;

import com.purchasingpower.docqa.model.document.Document;
import com.purchasingpower.docqa.model.document.IngestionResult;
import com.purchasingpower.docqa.model.document.IngestionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Document status as returned by upload, listing and re-ingestion.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

    private Long documentId;
    private String conversationId;
    private String filename;
    private IngestionStatus status;
    private int chunkCount;
    private String error;
    private LocalDateTime createdAt;

    public static DocumentResponse from(IngestionResult result) {
        return DocumentResponse.builder()
            .documentId(result.getDocumentId())
            .status(result.getStatus())
            .chunkCount(result.getChunkCount())
            .error(result.getError())
            .build();
    }

    public static DocumentResponse from(Document document) {
        return DocumentResponse.builder()
            .documentId(document.getId())
            .conversationId(document.getConversationId())
            .filename(document.getFilename())
            .status(document.getStatus())
            .chunkCount(document.getChunkCount())
            .error(document.getFailureReason())
            .createdAt(document.getCreatedAt())
            .build();
    }

    public static DocumentResponse error(String error) {
        return DocumentResponse.builder()
            .error(error)
            .build();
    }
}
