package com.purchasingpower.docqa.service;

import com.purchasingpower.docqa.model.conversation.MemoryTurn;
import com.purchasingpower.docqa.model.conversation.MessageRole;

import java.util.List;

/**
 * Per-conversation dialogue memory handed to the generator as prior turns.
 *
 * Memory is bounded by turn count and total characters; the oldest turns are
 * dropped first. It never crosses conversation boundaries.
 */
public interface ConversationMemory {

    void append(String conversationId, MessageRole role, String content);

    /**
     * Append a question and its answer as one step, so readers never see half an exchange.
     */
    void appendExchange(String conversationId, String question, String answer);

    /**
     * All retained turns, oldest first.
     */
    List<MemoryTurn> read(String conversationId);

    /**
     * The last {@code maxTurns} retained turns, oldest first.
     */
    List<MemoryTurn> recent(String conversationId, int maxTurns);

    void clear(String conversationId);
}
