package com.purchasingpower.docqa.exception;

import lombok.Getter;

@Getter
public class IngestionException extends RuntimeException {

    private final Long documentId;

    public IngestionException(Long documentId, String message, Throwable cause) {
        super(message, cause);
        this.documentId = documentId;
    }
}
