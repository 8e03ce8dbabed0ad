package com.purchasingpower.docqa.model.conversation;

/**
 * Author of a message or memory turn.
 */
public enum MessageRole {
    USER("user"),
    ASSISTANT("assistant");

    private final String value;

    MessageRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
