package com.purchasingpower.docqa.exception;

import lombok.Getter;

@Getter
public class GenerationException extends RuntimeException {

    private final int attempts;

    public GenerationException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }
}
