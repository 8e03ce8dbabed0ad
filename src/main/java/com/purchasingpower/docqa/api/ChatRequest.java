package com.purchasingpower.docqa.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request for chat endpoint.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    /**
     * The user's question.
     */
    private String message;

    /**
     * Existing conversation ID (null for new conversation).
     */
    private String conversationId;

    /**
     * User ID.
     */
    private String userId;

    /**
     * Optional filename: answer only from this document of the conversation.
     */
    private String documentName;
}
