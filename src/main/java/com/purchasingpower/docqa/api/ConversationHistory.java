package com.purchasingpower.docqa.api;

import com.purchasingpower.docqa.model.conversation.ConversationMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversation history response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationHistory {

    private String conversationId;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    public static ConversationHistory of(String conversationId, List<ConversationMessage> messages) {
        return ConversationHistory.builder()
            .conversationId(conversationId)
            .messages(new ArrayList<>(messages.stream().map(Message::from).toList()))
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Message {
        private Long id;
        private String role;
        private String content;
        private String mode;
        private Integer sourceCount;
        private String timestamp;

        static Message from(ConversationMessage message) {
            return Message.builder()
                .id(message.getId())
                .role(message.getRole().value())
                .content(message.getContent())
                .mode(message.getMode())
                .sourceCount(message.getSourceCount())
                .timestamp(message.getCreatedAt() != null ? message.getCreatedAt().toString() : null)
                .build();
        }
    }
}
