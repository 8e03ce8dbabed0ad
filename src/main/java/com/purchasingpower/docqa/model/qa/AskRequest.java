package com.purchasingpower.docqa.model.qa;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskRequest {

    /**
     * Conversation to answer in; null starts a new conversation.
     */
    private String conversationId;

    private String userId;

    private String question;

    /**
     * Optional filename restricting retrieval to one document of the conversation.
     */
    private String documentName;
}
