package com.purchasingpower.docqa.service;

import com.purchasingpower.docqa.model.conversation.MemoryTurn;

import java.util.List;

/**
 * Answer generation through the configured chat provider.
 */
public interface GenerationService {

    /**
     * @param prompt  rendered prompt for the current question
     * @param history earlier turns of the conversation, oldest first
     * @return generated answer text
     * @throws com.purchasingpower.docqa.exception.GenerationException when the provider keeps failing
     */
    String generate(String prompt, List<MemoryTurn> history);
}
