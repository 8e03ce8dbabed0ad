package com.purchasingpower.docqa.exception;

import lombok.Getter;

/**
 * A passage from one conversation surfaced while serving another.
 *
 * Never caught and corrected: the request is aborted.
 */
@Getter
public class IsolationViolationException extends RuntimeException {

    private final String requestedConversationId;
    private final String foundConversationId;
    private final Long chunkId;

    public IsolationViolationException(String requestedConversationId, String foundConversationId, Long chunkId) {
        super("Chunk " + chunkId + " belongs to conversation " + foundConversationId
                + " but was retrieved for conversation " + requestedConversationId);
        this.requestedConversationId = requestedConversationId;
        this.foundConversationId = foundConversationId;
        this.chunkId = chunkId;
    }
}
