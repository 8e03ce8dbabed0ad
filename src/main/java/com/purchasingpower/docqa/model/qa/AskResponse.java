package com.purchasingpower.docqa.model.qa;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskResponse {

    private String conversationId;

    /**
     * Id of the stored assistant message; null when the run failed.
     */
    private Long messageId;

    private QaStatus status;
    private String answer;
    private String error;

    @Builder.Default
    private List<SourceAttribution> sources = new ArrayList<>();

    private AnswerMetadata metadata;

    public boolean isCompleted() {
        return status == QaStatus.COMPLETED;
    }

    public static AskResponse failed(String conversationId, String error) {
        return AskResponse.builder()
                .conversationId(conversationId)
                .status(QaStatus.FAILED)
                .error(error)
                .answer("Sorry, I could not produce an answer right now. Please try again.")
                .build();
    }
}
