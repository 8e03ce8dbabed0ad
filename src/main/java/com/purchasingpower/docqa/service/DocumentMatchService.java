package com.purchasingpower.docqa.service;

import com.purchasingpower.docqa.model.document.DocumentMatch;

import java.util.List;

/**
 * Records which documents answered which assistant messages, and reports document usage.
 */
public interface DocumentMatchService {

    /**
     * Record (or update) the match between a message and a document.
     *
     * At most one match exists per (message, document); a repeated call replaces
     * passage and score of the existing row.
     *
     * @param score relevance in [0, 1]
     */
    DocumentMatch recordMatch(Long messageId, Long documentId, String passage, double score);

    /**
     * Number of answers this document has contributed to.
     */
    long usageCount(Long documentId);

    /**
     * Latest matches of a document, newest first, with their messages loaded.
     */
    List<DocumentMatch> recentMatches(Long documentId, int limit);

    /**
     * Matches of one message with their documents loaded, best score first.
     */
    List<DocumentMatch> matchesForMessage(Long messageId);
}
