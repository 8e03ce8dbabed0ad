package com.purchasingpower.docqa.exception;

import lombok.Getter;

@Getter
public class UnsupportedDocumentException extends RuntimeException {

    private final String filename;

    public UnsupportedDocumentException(String filename, String message) {
        super(message);
        this.filename = filename;
    }
}
