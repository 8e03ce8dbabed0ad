package com.purchasingpower.docqa.exception;

import lombok.Getter;

@Getter
public class MessageNotFoundException extends RuntimeException {

    private final Long messageId;

    public MessageNotFoundException(Long messageId) {
        super("Message not found: " + messageId);
        this.messageId = messageId;
    }
}
