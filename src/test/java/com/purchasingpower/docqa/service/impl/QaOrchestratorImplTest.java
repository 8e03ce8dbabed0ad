package com.purchasingpower.docqa.service.impl;

import com.purchasingpower.docqa.exception.ConversationNotFoundException;
import com.purchasingpower.docqa.model.conversation.Conversation;
import com.purchasingpower.docqa.model.conversation.ConversationMessage;
import com.purchasingpower.docqa.model.conversation.MessageRole;
import com.purchasingpower.docqa.model.document.DocumentMatch;
import com.purchasingpower.docqa.model.document.IngestionResult;
import com.purchasingpower.docqa.model.qa.AnswerMode;
import com.purchasingpower.docqa.model.qa.AskRequest;
import com.purchasingpower.docqa.model.qa.AskResponse;
import com.purchasingpower.docqa.model.qa.QaStatus;
import com.purchasingpower.docqa.model.qa.SourceAttribution;
import com.purchasingpower.docqa.service.ConversationMemory;
import com.purchasingpower.docqa.service.ConversationService;
import com.purchasingpower.docqa.service.DocumentMatchService;
import com.purchasingpower.docqa.service.DocumentService;
import com.purchasingpower.docqa.service.QaOrchestrator;
import com.purchasingpower.docqa.support.KeywordEmbeddingService;
import com.purchasingpower.docqa.support.ScriptedGenerationService;
import com.purchasingpower.docqa.support.TestProvidersConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests of question answering against H2 with deterministic providers.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestProvidersConfig.class)
class QaOrchestratorImplTest {

    @Autowired
    private QaOrchestrator orchestrator;

    @Autowired
    private ConversationService conversationService;

    @Autowired
    private DocumentService documentService;

    @Autowired
    private DocumentMatchService matchService;

    @Autowired
    private ConversationMemory memory;

    @Autowired
    private KeywordEmbeddingService embeddingService;

    @Autowired
    private ScriptedGenerationService generationService;

    @BeforeEach
    void setUp() {
        embeddingService.reset();
        generationService.reset();
    }

    @Test
    @DisplayName("Answers from the conversation's document and records the match")
    void ask_withRelevantDocument_answersInRagModeAndRecordsMatch() {
        // Given
        String conversationId = newConversation();
        IngestionResult upload = documentService.uploadDocument(conversationId, "france.txt",
                "Paris is the capital of France.");

        // When
        AskResponse response = ask(conversationId, "What is the capital of France?");

        // Then
        assertThat(response.getStatus()).isEqualTo(QaStatus.COMPLETED);
        assertThat(response.getAnswer()).contains("Paris");
        assertThat(response.getMetadata().getMode()).isEqualTo(AnswerMode.RAG);
        assertThat(response.getMetadata().getNumSources()).isEqualTo(1);
        assertThat(response.getSources()).singleElement().satisfies(source -> {
            assertThat(source.getDocumentId()).isEqualTo(upload.getDocumentId());
            assertThat(source.getDocumentName()).isEqualTo("france.txt");
            assertThat(source.getScore()).isBetween(0.0, 1.0);
        });

        List<DocumentMatch> matches = matchService.matchesForMessage(response.getMessageId());
        assertThat(matches).singleElement().satisfies(match -> {
            assertThat(match.getDocumentId()).isEqualTo(upload.getDocumentId());
            assertThat(match.getMatchedContent()).contains("Paris is the capital of France.");
        });
    }

    @Test
    @DisplayName("Answers from general knowledge when the conversation has no documents")
    void ask_withoutDocuments_usesAgentMode() {
        // Given
        String conversationId = newConversation();

        // When
        AskResponse response = ask(conversationId, "What is the capital of France?");

        // Then
        assertThat(response.getStatus()).isEqualTo(QaStatus.COMPLETED);
        assertThat(response.getMetadata().getMode()).isEqualTo(AnswerMode.AGENT);
        assertThat(response.getSources()).isEmpty();
        assertThat(response.getMessageId()).isNotNull();
        assertThat(embeddingService.getCalls()).isZero();
        assertThat(matchService.matchesForMessage(response.getMessageId())).isEmpty();
    }

    @Test
    @DisplayName("Never uses documents of another conversation")
    void ask_neverSeesDocumentsOfOtherConversations() {
        // Given
        String withDocument = newConversation();
        String withoutDocument = newConversation();
        documentService.uploadDocument(withDocument, "france.txt", "Paris is the capital of France.");

        // When
        AskResponse response = ask(withoutDocument, "What is the capital of France?");

        // Then
        assertThat(response.getMetadata().getMode()).isEqualTo(AnswerMode.AGENT);
        assertThat(response.getSources()).isEmpty();
        assertThat(generationService.lastPrompt()).doesNotContain("Paris");
    }

    @Test
    @DisplayName("Cites exactly the two documents relevant to a two-part question")
    void ask_synthesizesAcrossRelevantDocumentsOnly() {
        // Given
        String conversationId = newConversation();
        Long jupiter = documentService.uploadDocument(conversationId, "planets.txt",
                "Jupiter is the largest planet in the solar system.").getDocumentId();
        Long pandas = documentService.uploadDocument(conversationId, "pandas.txt",
                "Giant pandas eat bamboo almost exclusively.").getDocumentId();
        documentService.uploadDocument(conversationId, "history.txt",
                "The Treaty of Westphalia was signed in 1648.");

        // When
        AskResponse response = ask(conversationId, "What do giant pandas eat and which planet is the largest?");

        // Then
        assertThat(response.getMetadata().getMode()).isEqualTo(AnswerMode.RAG);
        assertThat(response.getMetadata().getNumSources()).isEqualTo(2);
        assertThat(response.getSources()).extracting(SourceAttribution::getDocumentId)
                .containsExactlyInAnyOrder(jupiter, pandas);
        assertThat(generationService.lastPrompt())
                .contains("planets.txt")
                .contains("pandas.txt")
                .doesNotContain("Westphalia");
        assertThat(matchService.matchesForMessage(response.getMessageId())).hasSize(2);
    }

    @Test
    @DisplayName("Falls back to agent mode when no passage is relevant")
    void ask_withOnlyIrrelevantDocuments_fallsBackToAgentMode() {
        // Given
        String conversationId = newConversation();
        documentService.uploadDocument(conversationId, "history.txt", "The Treaty of Westphalia was signed in 1648.");

        // When
        AskResponse response = ask(conversationId, "What do giant pandas eat?");

        // Then
        assertThat(response.getMetadata().getMode()).isEqualTo(AnswerMode.AGENT);
        assertThat(response.getSources()).isEmpty();
        assertThat(response.getMetadata().isDegraded()).isFalse();
        assertThat(response.getMetadata().getNote()).isNotBlank();
    }

    @Test
    @DisplayName("Degrades to agent mode with a note when retrieval fails")
    void ask_whenQueryEmbeddingFails_degradesToAgentMode() {
        // Given
        String conversationId = newConversation();
        documentService.uploadDocument(conversationId, "france.txt", "Paris is the capital of France.");
        embeddingService.failWhenTextContains("capital");

        // When
        AskResponse response = ask(conversationId, "What is the capital of France?");

        // Then
        assertThat(response.getStatus()).isEqualTo(QaStatus.COMPLETED);
        assertThat(response.getMetadata().getMode()).isEqualTo(AnswerMode.AGENT);
        assertThat(response.getMetadata().isDegraded()).isTrue();
        assertThat(response.getMetadata().getNote()).contains("unavailable");
    }

    @Test
    @DisplayName("A failed generation stores nothing and leaves memory untouched")
    void ask_whenGenerationFails_persistsNothing() {
        // Given
        String conversationId = newConversation();
        generationService.setFailing(true);

        // When
        AskResponse response = ask(conversationId, "What is the capital of France?");

        // Then
        assertThat(response.getStatus()).isEqualTo(QaStatus.FAILED);
        assertThat(response.getMessageId()).isNull();
        assertThat(response.getError()).contains("generation failed");
        assertThat(conversationService.getMessages(conversationId)).isEmpty();
        assertThat(memory.read(conversationId)).isEmpty();
    }

    @Test
    @DisplayName("Earlier turns are passed to the generator as history")
    void ask_followUp_receivesPreviousTurns() {
        // Given
        String conversationId = newConversation();
        ask(conversationId, "My name is Ada.");

        // When
        ask(conversationId, "What is my name?");

        // Then
        assertThat(generationService.lastHistory())
                .extracting(turn -> turn.getRole())
                .containsExactly(MessageRole.USER, MessageRole.ASSISTANT);
        assertThat(generationService.lastHistory().get(0).getContent()).isEqualTo("My name is Ada.");

        List<ConversationMessage> messages = conversationService.getMessages(conversationId);
        assertThat(messages).extracting(ConversationMessage::getPosition).containsExactly(0, 1, 2, 3);
        assertThat(conversationService.requireConversation(conversationId).getTitle()).isEqualTo("My name is Ada.");
    }

    @Test
    @DisplayName("Replaces an answer that asks the user to upload documents")
    void ask_whenModelAsksForUpload_usesGeneralKnowledgeFallback() {
        // Given
        String conversationId = newConversation();
        generationService.respondWith(prompt -> prompt.contains("The user asked:")
                ? "Paris is the capital of France."
                : "Please paste the document so I can help.");

        // When
        AskResponse response = ask(conversationId, "What is the capital of France?");

        // Then
        assertThat(response.getAnswer()).isEqualTo("Paris is the capital of France.");
        assertThat(generationService.getPrompts()).hasSize(2);
    }

    @Test
    @DisplayName("A document answer replaced by the general-knowledge fallback cites nothing")
    void ask_whenRagAnswerAsksForUpload_recordsAgentModeWithoutMatches() {
        // Given
        String conversationId = newConversation();
        documentService.uploadDocument(conversationId, "france.txt", "Paris is the capital of France.");
        generationService.respondWith(prompt -> prompt.contains("The user asked:")
                ? "Paris is the capital of France."
                : "Please provide the content of the document.");

        // When
        AskResponse response = ask(conversationId, "What is the capital of France?");

        // Then
        assertThat(response.getStatus()).isEqualTo(QaStatus.COMPLETED);
        assertThat(response.getAnswer()).isEqualTo("Paris is the capital of France.");
        assertThat(response.getMetadata().getMode()).isEqualTo(AnswerMode.AGENT);
        assertThat(response.getMetadata().getNote()).contains("general knowledge");
        assertThat(response.getSources()).isEmpty();
        assertThat(matchService.matchesForMessage(response.getMessageId())).isEmpty();
        assertThat(conversationService.getMessages(conversationId))
                .filteredOn(message -> message.getRole() == MessageRole.ASSISTANT)
                .extracting(ConversationMessage::getMode)
                .containsExactly("agent");
    }

    @Test
    @DisplayName("A slow earlier run inside its retry budget does not fail the next run's commit")
    void ask_slowEarlierRun_laterRunStillCompletes() throws Exception {
        // Given - the commit wait configured for tests is far below one run's retry budget
        String conversationId = newConversation();
        generationService.respondWith(prompt -> {
            if (prompt.contains("slow question")) {
                try {
                    Thread.sleep(2500);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return ScriptedGenerationService.GENERAL_ANSWER;
        });

        // When
        CompletableFuture<AskResponse> first = CompletableFuture.supplyAsync(() -> ask(conversationId, "A slow question"));
        Thread.sleep(200);
        CompletableFuture<AskResponse> second = CompletableFuture.supplyAsync(() -> ask(conversationId, "A quick one"));

        // Then
        assertThat(first.get(30, TimeUnit.SECONDS).getStatus()).isEqualTo(QaStatus.COMPLETED);
        assertThat(second.get(30, TimeUnit.SECONDS).getStatus()).isEqualTo(QaStatus.COMPLETED);
        assertThat(conversationService.getMessages(conversationId)).extracting(ConversationMessage::getContent)
                .containsExactly("A slow question", ScriptedGenerationService.GENERAL_ANSWER,
                        "A quick one", ScriptedGenerationService.GENERAL_ANSWER);
    }

    @Test
    @DisplayName("Starts a new conversation when none is given")
    void ask_withoutConversationId_createsConversation() {
        // When
        AskResponse response = orchestrator.ask(AskRequest.builder()
                .userId("qa-test")
                .question("Hello there")
                .build());

        // Then
        assertThat(response.getConversationId()).isNotBlank();
        assertThat(conversationService.getConversation(response.getConversationId())).isPresent();
    }

    @Test
    @DisplayName("Unknown conversation ids are rejected")
    void ask_withUnknownConversation_throws() {
        assertThatThrownBy(() -> ask("does-not-exist", "Hello?"))
                .isInstanceOf(ConversationNotFoundException.class);
    }

    @Test
    @DisplayName("Concurrent questions in one conversation are stored without gaps or duplicates")
    void ask_concurrentQuestions_storeConsistentHistory() throws Exception {
        // Given
        String conversationId = newConversation();

        // When
        CompletableFuture<AskResponse> first = CompletableFuture.supplyAsync(() -> ask(conversationId, "First question"));
        CompletableFuture<AskResponse> second = CompletableFuture.supplyAsync(() -> ask(conversationId, "Second question"));
        CompletableFuture.allOf(first, second).get(30, TimeUnit.SECONDS);

        // Then
        List<ConversationMessage> messages = conversationService.getMessages(conversationId);
        assertThat(messages).extracting(ConversationMessage::getPosition).containsExactly(0, 1, 2, 3);
        assertThat(messages).extracting(ConversationMessage::getRole)
                .containsExactly(MessageRole.USER, MessageRole.ASSISTANT, MessageRole.USER, MessageRole.ASSISTANT);
        assertThat(memory.read(conversationId)).hasSize(4);
    }

    private String newConversation() {
        Conversation conversation = conversationService.createConversation("qa-test", null);
        return conversation.getConversationId();
    }

    private AskResponse ask(String conversationId, String question) {
        return orchestrator.ask(AskRequest.builder()
                .conversationId(conversationId)
                .userId("qa-test")
                .question(question)
                .build());
    }
}
