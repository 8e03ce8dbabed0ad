package com.purchasingpower.docqa.model.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of ingesting one document.
 *
 * A failed result still reports how many passages were stored before the failure;
 * those passages stay searchable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResult {

    private boolean success;
    private Long documentId;
    private IngestionStatus status;
    private int chunkCount;
    private long durationMs;
    private String error;

    public static IngestionResult success(Long documentId, int chunkCount, long durationMs) {
        return IngestionResult.builder()
                .success(true)
                .documentId(documentId)
                .status(IngestionStatus.READY)
                .chunkCount(chunkCount)
                .durationMs(durationMs)
                .build();
    }

    public static IngestionResult failure(Long documentId, int chunkCount, String error, long durationMs) {
        return IngestionResult.builder()
                .success(false)
                .documentId(documentId)
                .status(IngestionStatus.FAILED)
                .chunkCount(chunkCount)
                .error(error)
                .durationMs(durationMs)
                .build();
    }
}
