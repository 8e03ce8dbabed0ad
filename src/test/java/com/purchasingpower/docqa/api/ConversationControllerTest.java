package com.purchasingpower.docqa.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.docqa.support.KeywordEmbeddingService;
import com.purchasingpower.docqa.support.PdfFixtures;
import com.purchasingpower.docqa.support.TestProvidersConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestProvidersConfig.class)
class ConversationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private KeywordEmbeddingService embeddingService;

    @BeforeEach
    void setUp() {
        embeddingService.reset();
    }

    @Test
    @DisplayName("Creating a conversation returns its id and default title")
    void create_returnsCreated() throws Exception {
        mockMvc.perform(post("/api/v1/conversations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(CreateConversationRequest.builder().userId("alice").build())))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.conversationId").isNotEmpty())
            .andExpect(jsonPath("$.userId").value("alice"))
            .andExpect(jsonPath("$.title").isNotEmpty());
    }

    @Test
    void list_filtersByUser() throws Exception {
        String userId = "list-user-" + System.nanoTime();
        String conversationId = createConversation(userId);

        mockMvc.perform(get("/api/v1/conversations").param("userId", userId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].conversationId").value(conversationId));

        mockMvc.perform(get("/api/v1/conversations").param("userId", "nobody-" + System.nanoTime()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    @DisplayName("Text uploads are ingested and listed with their status")
    void uploadText_thenList() throws Exception {
        // Given
        String conversationId = createConversation("upload-user");

        // When
        mockMvc.perform(post("/api/v1/conversations/{id}/documents", conversationId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(DocumentUploadRequest.builder()
                    .filename("notes.txt").content("Meeting moved to Thursday.").build())))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.documentId").isNumber())
            .andExpect(jsonPath("$.conversationId").value(conversationId))
            .andExpect(jsonPath("$.status").value("READY"))
            .andExpect(jsonPath("$.chunkCount").value(1));

        // Then
        mockMvc.perform(get("/api/v1/conversations/{id}/documents", conversationId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].filename").value("notes.txt"))
            .andExpect(jsonPath("$[0].status").value("READY"));
    }

    @Test
    void uploadText_missingFilename_returnsBadRequest() throws Exception {
        String conversationId = createConversation("upload-user");

        mockMvc.perform(post("/api/v1/conversations/{id}/documents", conversationId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\":\"text\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void uploadText_unknownConversation_returnsNotFound() throws Exception {
        mockMvc.perform(post("/api/v1/conversations/{id}/documents", "missing-conversation")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(DocumentUploadRequest.builder()
                    .filename("a.txt").content("text").build())))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Plain-text files are accepted as multipart uploads")
    void uploadFile_plainText() throws Exception {
        String conversationId = createConversation("upload-user");
        MockMultipartFile file = new MockMultipartFile("file", "readme.md", "text/markdown",
            "# Setup\nRun the installer.".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/v1/conversations/{id}/documents/file", conversationId).file(file))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.filename").value("readme.md"))
            .andExpect(jsonPath("$.status").value("READY"));
    }

    @Test
    @DisplayName("PDF files are extracted and ingested")
    void uploadFile_pdf() throws Exception {
        String conversationId = createConversation("upload-user");
        MockMultipartFile file = new MockMultipartFile("file", "handbook.pdf", "application/pdf",
            PdfFixtures.pdfWithPages("Employees receive twenty days of paid leave."));

        mockMvc.perform(multipart("/api/v1/conversations/{id}/documents/file", conversationId).file(file))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.filename").value("handbook.pdf"))
            .andExpect(jsonPath("$.status").value("READY"))
            .andExpect(jsonPath("$.chunkCount").value(1));
    }

    @Test
    @DisplayName("A file named .pdf that is not a PDF is rejected with 415")
    void uploadFile_corruptPdf() throws Exception {
        String conversationId = createConversation("upload-user");
        MockMultipartFile file = new MockMultipartFile("file", "scan.pdf", "application/pdf", new byte[]{1, 2, 3});

        mockMvc.perform(multipart("/api/v1/conversations/{id}/documents/file", conversationId).file(file))
            .andExpect(status().isUnsupportedMediaType())
            .andExpect(jsonPath("$.error").value(containsString("could not be read")));
    }

    @Test
    @DisplayName("Binary formats without an extractor are rejected with 415")
    void uploadFile_unsupportedType() throws Exception {
        String conversationId = createConversation("upload-user");
        MockMultipartFile file = new MockMultipartFile("file", "slides.pptx",
            "application/vnd.openxmlformats-officedocument.presentationml.presentation", new byte[]{1, 2, 3});

        mockMvc.perform(multipart("/api/v1/conversations/{id}/documents/file", conversationId).file(file))
            .andExpect(status().isUnsupportedMediaType())
            .andExpect(jsonPath("$.error").isNotEmpty());
    }

    @Test
    @DisplayName("Deleting a conversation removes it and its documents")
    void delete_removesConversation() throws Exception {
        // Given
        String conversationId = createConversation("delete-user");
        mockMvc.perform(post("/api/v1/conversations/{id}/documents", conversationId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(DocumentUploadRequest.builder()
                    .filename("gone.txt").content("Soon to be deleted.").build())))
            .andExpect(status().isCreated());

        // When
        mockMvc.perform(delete("/api/v1/conversations/{id}", conversationId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true));

        // Then
        mockMvc.perform(get("/api/v1/conversations/{id}/documents", conversationId))
            .andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/v1/conversations/{id}", conversationId))
            .andExpect(status().isNotFound());
    }

    @Test
    void messages_unknownConversation_returnsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/conversations/{id}/messages", "missing-conversation"))
            .andExpect(status().isNotFound());
    }

    private String createConversation(String userId) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/conversations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(CreateConversationRequest.builder().userId(userId).build())))
            .andExpect(status().isCreated())
            .andReturn();
        return objectMapper.readValue(result.getResponse().getContentAsString(), ConversationSummary.class)
            .getConversationId();
    }
}
