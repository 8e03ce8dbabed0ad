package com.purchasingpower.docqa.api;

import com.purchasingpower.docqa.exception.DocumentNotFoundException;
import com.purchasingpower.docqa.exception.IngestionException;
import com.purchasingpower.docqa.exception.MessageNotFoundException;
import com.purchasingpower.docqa.model.document.DocumentPreview;
import com.purchasingpower.docqa.service.DocumentMatchService;
import com.purchasingpower.docqa.service.DocumentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for document previews, re-ingestion and message matches.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentService documentService;
    private final DocumentMatchService matchService;

    /**
     * GET /api/v1/documents/{documentId}/preview
     */
    @GetMapping("/documents/{documentId}/preview")
    public ResponseEntity<DocumentPreview> preview(@PathVariable Long documentId) {
        try {
            return ResponseEntity.ok(documentService.previewDocument(documentId));
        } catch (DocumentNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * POST /api/v1/documents/{documentId}/reingest
     */
    @PostMapping("/documents/{documentId}/reingest")
    public ResponseEntity<DocumentResponse> reingest(@PathVariable Long documentId) {
        try {
            return ResponseEntity.ok(DocumentResponse.from(documentService.reingest(documentId)));
        } catch (DocumentNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (IngestionException e) {
            return ResponseEntity.unprocessableEntity().body(DocumentResponse.error(e.getMessage()));
        }
    }

    /**
     * GET /api/v1/messages/{messageId}/document-matches
     */
    @GetMapping("/messages/{messageId}/document-matches")
    public ResponseEntity<List<DocumentMatchResponse>> matches(@PathVariable Long messageId) {
        try {
            return ResponseEntity.ok(matchService.matchesForMessage(messageId).stream()
                .map(DocumentMatchResponse::from)
                .toList());
        } catch (MessageNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }
}
