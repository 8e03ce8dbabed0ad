package com.purchasingpower.docqa.api;

import com.purchasingpower.docqa.exception.ConversationNotFoundException;
import com.purchasingpower.docqa.exception.UnsupportedDocumentException;
import com.purchasingpower.docqa.model.conversation.Conversation;
import com.purchasingpower.docqa.model.document.IngestionResult;
import com.purchasingpower.docqa.service.ConversationService;
import com.purchasingpower.docqa.service.DocumentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * REST controller for conversations and the documents uploaded into them.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/conversations")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationService conversationService;
    private final DocumentService documentService;

    /**
     * POST /api/v1/conversations
     */
    @PostMapping
    public ResponseEntity<ConversationSummary> create(@RequestBody(required = false) CreateConversationRequest request) {
        String userId = request != null ? request.getUserId() : null;
        String title = request != null ? request.getTitle() : null;
        Conversation conversation = conversationService.createConversation(userId, title);
        return ResponseEntity.status(HttpStatus.CREATED).body(ConversationSummary.from(conversation));
    }

    /**
     * GET /api/v1/conversations?userId=...
     */
    @GetMapping
    public ResponseEntity<List<ConversationSummary>> list(@RequestParam(required = false) String userId) {
        List<ConversationSummary> conversations = conversationService.listConversations(userId).stream()
            .map(ConversationSummary::from)
            .toList();
        return ResponseEntity.ok(conversations);
    }

    /**
     * GET /api/v1/conversations/{conversationId}/messages
     */
    @GetMapping("/{conversationId}/messages")
    public ResponseEntity<ConversationHistory> messages(@PathVariable String conversationId) {
        try {
            return ResponseEntity.ok(ConversationHistory.of(conversationId,
                conversationService.getMessages(conversationId)));
        } catch (ConversationNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * DELETE /api/v1/conversations/{conversationId}
     *
     * Removes documents, passages, messages, matches and memory of the conversation.
     */
    @DeleteMapping("/{conversationId}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String conversationId) {
        try {
            conversationService.deleteConversation(conversationId);
            return ResponseEntity.ok(Map.of("success", true, "conversationId", conversationId));
        } catch (ConversationNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("success", false, "error", e.getMessage()));
        }
    }

    /**
     * POST /api/v1/conversations/{conversationId}/documents
     *
     * Upload already extracted text.
     */
    @PostMapping("/{conversationId}/documents")
    public ResponseEntity<DocumentResponse> uploadText(@PathVariable String conversationId,
                                                       @Valid @RequestBody DocumentUploadRequest request) {
        try {
            IngestionResult result = documentService.uploadDocument(conversationId, request.getFilename(),
                request.getContent());
            return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(conversationId, request.getFilename(), result));
        } catch (ConversationNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(DocumentResponse.error(e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(DocumentResponse.error(e.getMessage()));
        }
    }

    /**
     * POST /api/v1/conversations/{conversationId}/documents/file (multipart)
     */
    @PostMapping(value = "/{conversationId}/documents/file", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DocumentResponse> uploadFile(@PathVariable String conversationId,
                                                       @RequestParam("file") MultipartFile file) {
        String filename = file.getOriginalFilename();
        try {
            IngestionResult result = documentService.uploadFile(conversationId, filename, file.getBytes());
            return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(conversationId, filename, result));
        } catch (ConversationNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(DocumentResponse.error(e.getMessage()));
        } catch (UnsupportedDocumentException e) {
            return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE).body(DocumentResponse.error(e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(DocumentResponse.error(e.getMessage()));
        } catch (IOException e) {
            log.error("Failed to read uploaded file {}", filename, e);
            return ResponseEntity.internalServerError()
                .body(DocumentResponse.error("Failed to read uploaded file: " + e.getMessage()));
        }
    }

    /**
     * GET /api/v1/conversations/{conversationId}/documents
     */
    @GetMapping("/{conversationId}/documents")
    public ResponseEntity<List<DocumentResponse>> documents(@PathVariable String conversationId) {
        try {
            return ResponseEntity.ok(documentService.listDocuments(conversationId).stream()
                .map(DocumentResponse::from)
                .toList());
        } catch (ConversationNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    private DocumentResponse toResponse(String conversationId, String filename, IngestionResult result) {
        DocumentResponse response = DocumentResponse.from(result);
        response.setConversationId(conversationId);
        response.setFilename(filename);
        return response;
    }
}
