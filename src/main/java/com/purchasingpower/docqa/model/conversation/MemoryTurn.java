package com.purchasingpower.docqa.model.conversation;

import lombok.Value;

/**
 * One (role, content) entry of conversation memory.
 */
@Value
public class MemoryTurn {
    MessageRole role;
    String content;

    public static MemoryTurn user(String content) {
        return new MemoryTurn(MessageRole.USER, content);
    }

    public static MemoryTurn assistant(String content) {
        return new MemoryTurn(MessageRole.ASSISTANT, content);
    }

    public int length() {
        return content != null ? content.length() : 0;
    }
}
