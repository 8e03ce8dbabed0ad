package com.purchasingpower.docqa.exception;

import lombok.Getter;

/**
 * The vector index could not be queried. Callers degrade to agent mode.
 */
@Getter
public class RetrievalException extends RuntimeException {

    private final String conversationId;

    public RetrievalException(String conversationId, String message, Throwable cause) {
        super(message, cause);
        this.conversationId = conversationId;
    }
}
