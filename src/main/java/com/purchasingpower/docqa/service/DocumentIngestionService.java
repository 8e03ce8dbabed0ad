package com.purchasingpower.docqa.service;

import com.purchasingpower.docqa.model.document.IngestionResult;

/**
 * Turns a document's text into embedded, searchable passages.
 */
public interface DocumentIngestionService {

    /**
     * Split, embed and store the passages of a document.
     *
     * Never throws for provider trouble: the document is marked FAILED and a failed
     * result is returned. Passages stored before the failure are kept.
     *
     * @throws com.purchasingpower.docqa.exception.DocumentNotFoundException if the document does not exist
     */
    IngestionResult ingest(Long documentId, String text);
}
