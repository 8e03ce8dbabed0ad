package com.purchasingpower.docqa.service.impl;

import com.purchasingpower.docqa.exception.ConversationNotFoundException;
import com.purchasingpower.docqa.knowledge.ScoredChunk;
import com.purchasingpower.docqa.model.conversation.Conversation;
import com.purchasingpower.docqa.model.conversation.ConversationMessage;
import com.purchasingpower.docqa.model.conversation.MessageRole;
import com.purchasingpower.docqa.model.qa.RecordedExchange;
import com.purchasingpower.docqa.repository.ConversationMessageRepository;
import com.purchasingpower.docqa.repository.ConversationRepository;
import com.purchasingpower.docqa.repository.DocumentChunkRepository;
import com.purchasingpower.docqa.repository.DocumentMatchRepository;
import com.purchasingpower.docqa.service.ConversationMemory;
import com.purchasingpower.docqa.service.ConversationService;
import com.purchasingpower.docqa.service.DocumentMatchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Implementation of ConversationService.
 *
 * Responsible for persisting conversations, their messages and document matches.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationServiceImpl implements ConversationService {

    private final ConversationRepository conversationRepo;
    private final ConversationMessageRepository messageRepo;
    private final DocumentChunkRepository chunkRepo;
    private final DocumentMatchRepository matchRepo;
    private final DocumentMatchService matchService;
    private final ConversationMemory memory;

    @Override
    @Transactional
    public Conversation createConversation(String userId, String title) {
        // Default to "anonymous" if userId is null
        String effectiveUserId = (userId != null && !userId.trim().isEmpty()) ? userId : "anonymous";
        String conversationId = UUID.randomUUID().toString();
        log.info("Creating conversation: {} for user: {}", conversationId, effectiveUserId);

        Conversation conversation = Conversation.builder()
                .conversationId(conversationId)
                .userId(effectiveUserId)
                .title(title != null && !title.isBlank() ? title : Conversation.DEFAULT_TITLE)
                .build();

        return conversationRepo.save(conversation);
    }

    @Override
    public Optional<Conversation> getConversation(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            return Optional.empty();
        }
        return conversationRepo.findById(conversationId);
    }

    @Override
    public Conversation requireConversation(String conversationId) {
        return getConversation(conversationId)
                .orElseThrow(() -> new ConversationNotFoundException(conversationId));
    }

    @Override
    public List<Conversation> listConversations(String userId) {
        String effectiveUserId = (userId != null && !userId.trim().isEmpty()) ? userId : "anonymous";
        return conversationRepo.findByUserIdOrderByUpdatedAtDesc(effectiveUserId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ConversationMessage> getMessages(String conversationId) {
        requireConversation(conversationId);
        return messageRepo.findByConversationIdOrdered(conversationId);
    }

    @Override
    @Transactional
    public RecordedExchange recordExchange(String conversationId, String question, String answer,
                                           String mode, List<ScoredChunk> citations) {
        Conversation conversation = requireConversation(conversationId);
        int position = messageRepo.findMaxPosition(conversationId) + 1;

        ConversationMessage userMessage = messageRepo.save(ConversationMessage.builder()
                .conversation(conversation)
                .role(MessageRole.USER)
                .content(question)
                .position(position)
                .build());

        ConversationMessage assistantMessage = messageRepo.save(ConversationMessage.builder()
                .conversation(conversation)
                .role(MessageRole.ASSISTANT)
                .content(answer)
                .position(position + 1)
                .mode(mode)
                .sourceCount(citations.size())
                .build());

        for (ScoredChunk citation : citations) {
            matchService.recordMatch(assistantMessage.getId(), citation.getDocumentId(),
                    citation.getContent(), citation.getScore());
        }

        conversation.titleFromFirstQuestion(question);
        conversation.touch();
        conversationRepo.save(conversation);

        log.debug("Recorded exchange in {}: messages {}/{} with {} matches",
                conversationId, userMessage.getId(), assistantMessage.getId(), citations.size());
        return new RecordedExchange(userMessage.getId(), assistantMessage.getId(), citations.size());
    }

    @Override
    @Transactional
    public void deleteConversation(String conversationId) {
        requireConversation(conversationId);

        int matches = matchRepo.deleteByConversationId(conversationId);
        int chunks = chunkRepo.deleteByConversationId(conversationId);

        // bulk deletes cleared the persistence context
        conversationRepo.findById(conversationId).ifPresent(conversationRepo::delete);
        memory.clear(conversationId);

        log.info("🗑️ Deleted conversation {} ({} passages, {} matches)", conversationId, chunks, matches);
    }
}
