package com.purchasingpower.docqa.service.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.docqa.exception.DocumentNotFoundException;
import com.purchasingpower.docqa.exception.MessageNotFoundException;
import com.purchasingpower.docqa.model.conversation.ConversationMessage;
import com.purchasingpower.docqa.model.document.Document;
import com.purchasingpower.docqa.model.document.DocumentMatch;
import com.purchasingpower.docqa.repository.ConversationMessageRepository;
import com.purchasingpower.docqa.repository.DocumentMatchRepository;
import com.purchasingpower.docqa.repository.DocumentRepository;
import com.purchasingpower.docqa.service.DocumentMatchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentMatchServiceImpl implements DocumentMatchService {

    private final DocumentMatchRepository matchRepository;
    private final ConversationMessageRepository messageRepository;
    private final DocumentRepository documentRepository;

    @Override
    @Transactional
    public DocumentMatch recordMatch(Long messageId, Long documentId, String passage, double score) {
        Preconditions.checkArgument(score >= 0.0 && score <= 1.0,
                "Relevance score must be within [0, 1], got %s", score);

        String matchedContent = passage == null ? "" : passage;
        if (matchedContent.length() > DocumentMatch.MAX_MATCHED_CONTENT) {
            matchedContent = matchedContent.substring(0, DocumentMatch.MAX_MATCHED_CONTENT);
        }

        DocumentMatch existing = matchRepository.findByMessageIdAndDocumentId(messageId, documentId).orElse(null);
        if (existing != null) {
            existing.setMatchedContent(matchedContent);
            existing.setRelevanceScore(score);
            log.debug("🔁 Updated match message={} document={} score={}", messageId, documentId, score);
            return matchRepository.save(existing);
        }

        ConversationMessage message = messageRepository.findById(messageId)
                .orElseThrow(() -> new MessageNotFoundException(messageId));
        Document document = documentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));

        Preconditions.checkArgument(Objects.equals(message.getConversationId(), document.getConversationId()),
                "Document %s does not belong to the conversation of message %s", documentId, messageId);

        DocumentMatch match = DocumentMatch.builder()
                .message(message)
                .document(document)
                .matchedContent(matchedContent)
                .relevanceScore(score)
                .build();

        log.debug("📌 Recorded match message={} document={} score={}", messageId, documentId, score);
        return matchRepository.save(match);
    }

    @Override
    @Transactional(readOnly = true)
    public long usageCount(Long documentId) {
        return matchRepository.countByDocumentId(documentId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DocumentMatch> recentMatches(Long documentId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return matchRepository.findRecentByDocumentId(documentId, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public List<DocumentMatch> matchesForMessage(Long messageId) {
        if (!messageRepository.existsById(messageId)) {
            throw new MessageNotFoundException(messageId);
        }
        return matchRepository.findByMessageId(messageId);
    }
}
