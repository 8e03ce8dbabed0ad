package com.purchasingpower.docqa.api;

import com.purchasingpower.docqa.model.qa.AnswerMetadata;
import com.purchasingpower.docqa.model.qa.AskResponse;
import com.purchasingpower.docqa.model.qa.QaStatus;
import com.purchasingpower.docqa.model.qa.SourceAttribution;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response from chat endpoint.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private boolean success;
    private String conversationId;
    private Long messageId;
    private QaStatus status;
    private String response;
    private String error;

    @Builder.Default
    private List<SourceAttribution> sources = new ArrayList<>();

    private AnswerMetadata metadata;

    public static ChatResponse from(AskResponse answer) {
        return ChatResponse.builder()
            .success(answer.isCompleted())
            .conversationId(answer.getConversationId())
            .messageId(answer.getMessageId())
            .status(answer.getStatus())
            .response(answer.getAnswer())
            .error(answer.getError())
            .sources(answer.getSources())
            .metadata(answer.getMetadata())
            .build();
    }

    public static ChatResponse error(String error) {
        return ChatResponse.builder()
            .success(false)
            .status(QaStatus.FAILED)
            .error(error)
            .build();
    }
}
