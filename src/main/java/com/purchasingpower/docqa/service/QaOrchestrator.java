package com.purchasingpower.docqa.service;

import com.purchasingpower.docqa.model.qa.AskRequest;
import com.purchasingpower.docqa.model.qa.AskResponse;

/**
 * Answers a question inside one conversation.
 *
 * Uses the conversation's own documents when they hold relevant passages (RAG
 * mode) and general knowledge otherwise (agent mode).
 */
public interface QaOrchestrator {

    /**
     * @return a COMPLETED response, or a FAILED one when generation or persistence failed
     * @throws com.purchasingpower.docqa.exception.ConversationNotFoundException for an unknown conversation id
     * @throws com.purchasingpower.docqa.exception.IsolationViolationException   if retrieval crossed conversations
     */
    AskResponse ask(AskRequest request);
}
