package com.purchasingpower.docqa.service;

import com.purchasingpower.docqa.knowledge.ScoredChunk;
import com.purchasingpower.docqa.model.conversation.Conversation;
import com.purchasingpower.docqa.model.conversation.ConversationMessage;
import com.purchasingpower.docqa.model.qa.RecordedExchange;

import java.util.List;
import java.util.Optional;

/**
 * Service for managing conversations and their persistence.
 */
public interface ConversationService {

    /**
     * Create a new, empty conversation.
     */
    Conversation createConversation(String userId, String title);

    Optional<Conversation> getConversation(String conversationId);

    /**
     * @throws com.purchasingpower.docqa.exception.ConversationNotFoundException if it does not exist
     */
    Conversation requireConversation(String conversationId);

    /**
     * Conversations of a user, most recently active first.
     */
    List<Conversation> listConversations(String userId);

    /**
     * Messages of a conversation in order.
     */
    List<ConversationMessage> getMessages(String conversationId);

    /**
     * Persist one question/answer exchange and the matches of its cited documents
     * in a single transaction.
     *
     * @param citations best passage per contributing document
     */
    RecordedExchange recordExchange(String conversationId, String question, String answer,
                                    String mode, List<ScoredChunk> citations);

    /**
     * Delete a conversation with its documents, passages, messages, matches and memory.
     */
    void deleteConversation(String conversationId);
}
