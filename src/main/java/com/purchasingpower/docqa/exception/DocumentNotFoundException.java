package com.purchasingpower.docqa.exception;

import lombok.Getter;

@Getter
public class DocumentNotFoundException extends RuntimeException {

    private final Long documentId;

    public DocumentNotFoundException(Long documentId) {
        super("Document not found: " + documentId);
        this.documentId = documentId;
    }
}
