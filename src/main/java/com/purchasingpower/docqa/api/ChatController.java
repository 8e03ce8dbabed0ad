package com.purchasingpower.docqa.api;

import com.purchasingpower.docqa.exception.ConversationNotFoundException;
import com.purchasingpower.docqa.exception.IsolationViolationException;
import com.purchasingpower.docqa.model.qa.AskRequest;
import com.purchasingpower.docqa.model.qa.AskResponse;
import com.purchasingpower.docqa.service.QaOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.CompletableFuture;

/**
 * REST controller for chat API.
 *
 * Questions are answered on the QA executor, so a slow model call in one
 * conversation never blocks requests of another.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/chat")
public class ChatController {

    private final QaOrchestrator orchestrator;
    private final TaskExecutor qaExecutor;

    public ChatController(QaOrchestrator orchestrator, @Qualifier("qaExecutor") TaskExecutor qaExecutor) {
        this.orchestrator = orchestrator;
        this.qaExecutor = qaExecutor;
    }

    /**
     * Ask a question.
     *
     * POST /api/v1/chat
     *
     * Without conversationId a new conversation is started.
     */
    @PostMapping
    public CompletableFuture<ResponseEntity<ChatResponse>> chat(@RequestBody ChatRequest request) {
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            return CompletableFuture.completedFuture(ResponseEntity.badRequest()
                .body(ChatResponse.error("Message is required")));
        }

        AskRequest ask = AskRequest.builder()
            .conversationId(request.getConversationId())
            .userId(request.getUserId() != null ? request.getUserId() : "anonymous")
            .question(request.getMessage())
            .documentName(request.getDocumentName())
            .build();

        return CompletableFuture.supplyAsync(() -> answer(ask), qaExecutor);
    }

    private ResponseEntity<ChatResponse> answer(AskRequest ask) {
        try {
            AskResponse answer = orchestrator.ask(ask);
            if (!answer.isCompleted()) {
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ChatResponse.from(answer));
            }
            return ResponseEntity.ok(ChatResponse.from(answer));

        } catch (ConversationNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ChatResponse.error("Conversation not found: " + e.getConversationId()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ChatResponse.error(e.getMessage()));
        } catch (IsolationViolationException e) {
            log.error("🚨 Chat aborted, conversation isolation violated", e);
            return ResponseEntity.internalServerError()
                .body(ChatResponse.error("Internal error: request aborted"));
        } catch (Exception e) {
            log.error("Chat failed", e);
            return ResponseEntity.internalServerError()
                .body(ChatResponse.error("Internal error: " + e.getMessage()));
        }
    }
}
