package com.purchasingpower.docqa.service.impl;

import com.purchasingpower.docqa.client.LLMProvider;
import com.purchasingpower.docqa.client.LLMProviderFactory;
import com.purchasingpower.docqa.client.ProviderKind;
import com.purchasingpower.docqa.exception.ProviderException;
import com.purchasingpower.docqa.model.conversation.MemoryTurn;
import com.purchasingpower.docqa.model.document.Document;
import com.purchasingpower.docqa.model.document.IngestionResult;
import com.purchasingpower.docqa.model.document.IngestionStatus;
import com.purchasingpower.docqa.repository.DocumentChunkRepository;
import com.purchasingpower.docqa.repository.DocumentRepository;
import com.purchasingpower.docqa.service.ConversationService;
import com.purchasingpower.docqa.service.DocumentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Ingestion through the real embedding service and its retry executor, with a
 * provider that fails transiently.
 */
@SpringBootTest
@ActiveProfiles("test")
class DocumentIngestionRetryTest {

    private static final String FIRST_PARAGRAPH = "Alpha beta gamma delta. ".repeat(25).trim();
    private static final String SECOND_PARAGRAPH = "Kappa lambda mu nu. ".repeat(30).trim();
    private static final String BROKEN_PARAGRAPH = "Omega sigma BROKEN tau. ".repeat(25).trim();

    @MockBean
    private LLMProviderFactory providerFactory;

    @Autowired
    private DocumentService documentService;

    @Autowired
    private ConversationService conversationService;

    @Autowired
    private DocumentRepository documentRepository;

    @Autowired
    private DocumentChunkRepository chunkRepository;

    private FlakyEmbeddingProvider provider;

    @BeforeEach
    void setUp() {
        provider = new FlakyEmbeddingProvider();
        when(providerFactory.getEmbeddingProvider()).thenReturn(provider);
    }

    @Test
    @DisplayName("A transient embedding failure on every passage is retried and the document becomes READY")
    void ingest_retriesTransientFailures() {
        // Given
        String conversationId = conversationService.createConversation("retry-user", null).getConversationId();

        // When
        IngestionResult result = documentService.uploadDocument(conversationId, "flaky.txt",
                FIRST_PARAGRAPH + "\n\n" + SECOND_PARAGRAPH);

        // Then
        assertThat(result.getStatus()).isEqualTo(IngestionStatus.READY);
        assertThat(result.getChunkCount()).isEqualTo(2);
        assertThat(chunkRepository.countByDocumentId(result.getDocumentId())).isEqualTo(2);
        assertThat(provider.callsPerText()).hasSize(2).allSatisfy((text, calls) -> assertThat(calls).isEqualTo(2));
    }

    @Test
    @DisplayName("A passage that keeps failing exhausts its attempts and the document becomes FAILED")
    void ingest_whenRetriesAreExhausted_marksFailed() {
        // Given
        String conversationId = conversationService.createConversation("retry-user", null).getConversationId();

        // When
        IngestionResult result = documentService.uploadDocument(conversationId, "broken.txt",
                FIRST_PARAGRAPH + "\n\n" + SECOND_PARAGRAPH + "\n\n" + BROKEN_PARAGRAPH);

        // Then
        assertThat(result.getStatus()).isEqualTo(IngestionStatus.FAILED);
        assertThat(result.getChunkCount()).isEqualTo(2);
        assertThat(result.getError()).contains("passage 3 of 3");

        Document stored = documentRepository.findById(result.getDocumentId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(IngestionStatus.FAILED);
        assertThat(stored.getFailureReason()).contains("after 3 attempt(s)");
        assertThat(provider.callsPerText()).anySatisfy((text, calls) -> {
            assertThat(text).contains("BROKEN");
            assertThat(calls).isEqualTo(3);
        });
    }

    /**
     * Fails the first embedding of each text transiently, and every embedding of a
     * text containing BROKEN.
     */
    static class FlakyEmbeddingProvider implements LLMProvider {

        private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

        @Override
        public ProviderKind getKind() {
            return ProviderKind.LOCAL;
        }

        @Override
        public String generate(String prompt, List<MemoryTurn> history) {
            throw new UnsupportedOperationException("embedding only");
        }

        @Override
        public List<Double> embed(String text) {
            int call = calls.computeIfAbsent(text, t -> new AtomicInteger()).incrementAndGet();
            if (call == 1 || text.contains("BROKEN")) {
                throw new ProviderException(getProviderName(), "embedding service overloaded", true);
            }
            return List.of(1.0, text.length() / 1000.0, 0.5);
        }

        @Override
        public String getProviderName() {
            return "flaky-embedder";
        }

        Map<String, Integer> callsPerText() {
            Map<String, Integer> counts = new ConcurrentHashMap<>();
            calls.forEach((text, count) -> counts.put(text, count.get()));
            return counts;
        }
    }
}
