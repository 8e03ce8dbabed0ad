package com.purchasingpower.docqa.exception;

import lombok.Getter;

@Getter
public class ConversationNotFoundException extends RuntimeException {

    private final String conversationId;

    public ConversationNotFoundException(String conversationId) {
        super("Conversation not found: " + conversationId);
        this.conversationId = conversationId;
    }
}
