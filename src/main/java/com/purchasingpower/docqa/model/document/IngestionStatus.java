package com.purchasingpower.docqa.model.document;

/**
 * Ingestion state of an uploaded document.
 *
 * <pre>
 * PENDING → READY
 *    ↓
 *  FAILED
 * </pre>
 */
public enum IngestionStatus {

    /**
     * Text stored, passages not (all) embedded yet.
     */
    PENDING,

    /**
     * Every passage embedded and searchable.
     */
    READY,

    /**
     * Embedding gave up after retries. Passages embedded before the failure stay searchable.
     */
    FAILED
}
