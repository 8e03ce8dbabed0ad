package com.purchasingpower.docqa.service.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.docqa.exception.ConversationNotFoundException;
import com.purchasingpower.docqa.exception.DocumentNotFoundException;
import com.purchasingpower.docqa.exception.IngestionException;
import com.purchasingpower.docqa.exception.UnsupportedDocumentException;
import com.purchasingpower.docqa.model.conversation.Conversation;
import com.purchasingpower.docqa.model.document.Document;
import com.purchasingpower.docqa.model.document.DocumentMatch;
import com.purchasingpower.docqa.model.document.DocumentPreview;
import com.purchasingpower.docqa.model.document.IngestionResult;
import com.purchasingpower.docqa.model.document.IngestionStatus;
import com.purchasingpower.docqa.repository.ConversationRepository;
import com.purchasingpower.docqa.repository.DocumentChunkRepository;
import com.purchasingpower.docqa.repository.DocumentRepository;
import com.purchasingpower.docqa.service.DocumentIngestionService;
import com.purchasingpower.docqa.service.DocumentMatchService;
import com.purchasingpower.docqa.service.DocumentService;
import com.purchasingpower.docqa.service.TextExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static com.purchasingpower.docqa.util.ExternalCallLogger.snippet;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentServiceImpl implements DocumentService {

    static final int RECENT_MATCHES = 10;
    static final int MESSAGE_EXCERPT = 100;
    static final int MATCH_EXCERPT = 200;

    private final ConversationRepository conversationRepository;
    private final DocumentRepository documentRepository;
    private final DocumentChunkRepository chunkRepository;
    private final DocumentIngestionService ingestionService;
    private final DocumentMatchService matchService;
    private final List<TextExtractor> textExtractors;

    @Override
    public IngestionResult uploadDocument(String conversationId, String filename, String text) {
        Preconditions.checkArgument(filename != null && !filename.isBlank(), "filename is required");
        Conversation conversation = conversationRepository.findById(conversationId)
                .orElseThrow(() -> new ConversationNotFoundException(conversationId));

        Document document = documentRepository.save(Document.builder()
                .conversation(conversation)
                .userId(conversation.getUserId())
                .filename(filename)
                .content(text != null ? text : "")
                .status(IngestionStatus.PENDING)
                .build());

        log.info("📥 Uploaded document {} ({}) into conversation {}", document.getId(), filename, conversationId);
        return ingestionService.ingest(document.getId(), document.getContent());
    }

    @Override
    public IngestionResult uploadFile(String conversationId, String filename, byte[] content) {
        TextExtractor extractor = textExtractors.stream()
                .filter(candidate -> candidate.supports(filename))
                .findFirst()
                .orElseThrow(() -> new UnsupportedDocumentException(filename,
                        "Unsupported file type: " + filename + " (supported: .txt, .md, .markdown, .csv, .pdf)"));
        return uploadDocument(conversationId, filename, extractor.extract(filename, content));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Document> listDocuments(String conversationId) {
        if (!conversationRepository.existsById(conversationId)) {
            throw new ConversationNotFoundException(conversationId);
        }
        return documentRepository.findByConversationId(conversationId);
    }

    @Override
    @Transactional(readOnly = true)
    public DocumentPreview previewDocument(Long documentId) {
        Document document = documentRepository.findWithConversationById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));

        List<DocumentPreview.MatchPreview> recent = matchService.recentMatches(documentId, RECENT_MATCHES).stream()
                .map(this::toMatchPreview)
                .toList();

        return DocumentPreview.builder()
                .documentId(document.getId())
                .conversationId(document.getConversationId())
                .filename(document.getFilename())
                .status(document.getStatus())
                .chunkCount(document.getChunkCount())
                .content(document.getContent())
                .createdAt(document.getCreatedAt())
                .usageCount(matchService.usageCount(documentId))
                .recentMatches(recent)
                .build();
    }

    @Override
    public IngestionResult reingest(Long documentId) {
        Document document = documentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        if (document.getContent() == null) {
            throw new IngestionException(documentId, "Document " + documentId + " has no stored text to re-ingest", null);
        }

        int removed = chunkRepository.deleteByDocumentId(documentId);
        document.markPending();
        documentRepository.save(document);

        log.info("🔄 Re-ingesting document {} ({} old passages removed)", documentId, removed);
        return ingestionService.ingest(documentId, document.getContent());
    }

    private DocumentPreview.MatchPreview toMatchPreview(DocumentMatch match) {
        return DocumentPreview.MatchPreview.builder()
                .messageId(match.getMessageId())
                .messageExcerpt(snippet(match.getMessage().getContent(), MESSAGE_EXCERPT))
                .matchedExcerpt(snippet(match.getMatchedContent(), MATCH_EXCERPT))
                .relevanceScore(match.getRelevanceScore())
                .matchedAt(match.getUpdatedAt())
                .build();
    }
}
