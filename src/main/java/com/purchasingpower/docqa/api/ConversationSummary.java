package com.purchasingpower.docqa.api;

import com.purchasingpower.docqa.model.conversation.Conversation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSummary {

    private String conversationId;
    private String userId;
    private String title;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static ConversationSummary from(Conversation conversation) {
        return ConversationSummary.builder()
            .conversationId(conversation.getConversationId())
            .userId(conversation.getUserId())
            .title(conversation.getTitle())
            .createdAt(conversation.getCreatedAt())
            .updatedAt(conversation.getUpdatedAt())
            .build();
    }
}
