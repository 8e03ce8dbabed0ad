package com.purchasingpower.docqa.model.qa;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How an answer was produced: from retrieved passages or from general knowledge.
 */
public enum AnswerMode {
    RAG("rag"),
    AGENT("agent");

    private final String value;

    AnswerMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
