package com.purchasingpower.docqa.service;

import com.purchasingpower.docqa.model.document.Document;
import com.purchasingpower.docqa.model.document.DocumentPreview;
import com.purchasingpower.docqa.model.document.IngestionResult;

import java.util.List;

/**
 * Document lifecycle within a conversation: upload, listing, preview and re-ingestion.
 */
public interface DocumentService {

    /**
     * Store a document in a conversation and ingest it.
     *
     * @throws com.purchasingpower.docqa.exception.ConversationNotFoundException if the conversation does not exist
     */
    IngestionResult uploadDocument(String conversationId, String filename, String text);

    /**
     * Extract text from an uploaded file, then behave like {@link #uploadDocument(String, String, String)}.
     *
     * @throws com.purchasingpower.docqa.exception.UnsupportedDocumentException if the file type cannot be read
     */
    IngestionResult uploadFile(String conversationId, String filename, byte[] content);

    List<Document> listDocuments(String conversationId);

    /**
     * Full content plus usage statistics and the ten most recent matches.
     */
    DocumentPreview previewDocument(Long documentId);

    /**
     * Drop a document's passages and ingest its stored text again.
     */
    IngestionResult reingest(Long documentId);
}
