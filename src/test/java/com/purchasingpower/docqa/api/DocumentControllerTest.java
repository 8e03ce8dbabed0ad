package com.purchasingpower.docqa.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.docqa.model.document.IngestionResult;
import com.purchasingpower.docqa.model.qa.AskRequest;
import com.purchasingpower.docqa.model.qa.AskResponse;
import com.purchasingpower.docqa.service.ConversationService;
import com.purchasingpower.docqa.service.DocumentService;
import com.purchasingpower.docqa.service.QaOrchestrator;
import com.purchasingpower.docqa.support.KeywordEmbeddingService;
import com.purchasingpower.docqa.support.ScriptedGenerationService;
import com.purchasingpower.docqa.support.TestProvidersConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for document previews and message matches.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestProvidersConfig.class)
class DocumentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ConversationService conversationService;

    @Autowired
    private DocumentService documentService;

    @Autowired
    private QaOrchestrator orchestrator;

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
    @DisplayName("Preview shows content, usage count and the questions that used the document")
    void preview_afterQuestion_showsUsage() throws Exception {
        // Given
        String conversationId = conversationService.createConversation("preview-user", null).getConversationId();
        IngestionResult upload = documentService.uploadDocument(conversationId, "tides.txt",
            "Tides are caused by the gravity of the moon.");
        AskResponse answer = orchestrator.ask(AskRequest.builder()
            .conversationId(conversationId)
            .question("What causes tides?")
            .build());
        assertThat(answer.isCompleted()).isTrue();

        // When / Then
        mockMvc.perform(get("/api/v1/documents/{id}/preview", upload.getDocumentId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.filename").value("tides.txt"))
            .andExpect(jsonPath("$.conversationId").value(conversationId))
            .andExpect(jsonPath("$.status").value("READY"))
            .andExpect(jsonPath("$.content").value("Tides are caused by the gravity of the moon."))
            .andExpect(jsonPath("$.usageCount").value(1))
            .andExpect(jsonPath("$.recentMatches[0].messageId").value(answer.getMessageId()))
            .andExpect(jsonPath("$.recentMatches[0].messageExcerpt", startsWith("According to the documents")));
    }

    @Test
    @DisplayName("Matches of an answer list the documents it drew on")
    void matches_forAnswer_listDocuments() throws Exception {
        // Given
        String conversationId = conversationService.createConversation("preview-user", null).getConversationId();
        IngestionResult upload = documentService.uploadDocument(conversationId, "volcano.txt",
            "Volcanoes erupt when magma pressure builds up.");
        AskResponse answer = orchestrator.ask(AskRequest.builder()
            .conversationId(conversationId)
            .question("Why do volcanoes erupt?")
            .build());

        // When / Then
        mockMvc.perform(get("/api/v1/messages/{id}/document-matches", answer.getMessageId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].documentId").value(upload.getDocumentId()))
            .andExpect(jsonPath("$[0].filename").value("volcano.txt"))
            .andExpect(jsonPath("$[0].matchedContent").value("Volcanoes erupt when magma pressure builds up."))
            .andExpect(jsonPath("$[0].relevanceScore", closeTo(answer.getSources().get(0).getScore(), 1e-9)));
    }

    @Test
    void matches_unknownMessage_returnsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/messages/{id}/document-matches", 987654321L))
            .andExpect(status().isNotFound());
    }

    @Test
    void preview_unknownDocument_returnsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/documents/{id}/preview", 987654321L))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Re-ingesting rebuilds the passages of a document")
    void reingest_rebuildsPassages() throws Exception {
        String conversationId = conversationService.createConversation("preview-user", null).getConversationId();
        IngestionResult upload = documentService.uploadDocument(conversationId, "glaciers.txt",
            "Glaciers carve valleys over thousands of years.");

        mockMvc.perform(post("/api/v1/documents/{id}/reingest", upload.getDocumentId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.documentId").value(upload.getDocumentId()))
            .andExpect(jsonPath("$.status").value("READY"))
            .andExpect(jsonPath("$.chunkCount").value(1));
    }
}
