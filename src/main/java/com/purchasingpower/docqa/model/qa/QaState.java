package com.purchasingpower.docqa.model.qa;

import com.purchasingpower.docqa.knowledge.RetrievalResult;
import com.purchasingpower.docqa.model.document.Document;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Working state of one question-answering run.
 *
 * Carries data between phases and records the phases visited. Moving to a
 * phase that is not reachable from the current one is a programming error.
 */
@Getter
@Setter
public class QaState {

    private final String question;
    private final String conversationId;
    private final String documentName;

    @Setter(lombok.AccessLevel.NONE)
    private QaPhase phase = QaPhase.INIT;

    @Setter(lombok.AccessLevel.NONE)
    private final List<QaPhase> history = new ArrayList<>(List.of(QaPhase.INIT));

    private List<Document> documents = List.of();
    private RetrievalResult retrieval;
    private String context = "";
    private String prompt;
    private String answer;
    private AnswerMode mode;
    private boolean degraded;
    private String note;
    private String error;

    public QaState(String conversationId, String question, String documentName) {
        this.conversationId = conversationId;
        this.question = question;
        this.documentName = documentName;
    }

    public void transitionTo(QaPhase target) {
        if (!phase.next().contains(target)) {
            throw new IllegalStateException("Illegal QA transition " + phase + " -> " + target);
        }
        phase = target;
        history.add(target);
    }

    public List<QaPhase> getHistory() {
        return List.copyOf(history);
    }

    public boolean hasDocumentFilter() {
        return documentName != null && !documentName.isBlank();
    }
}
