package com.purchasingpower.docqa.service.impl;

import com.purchasingpower.docqa.exception.DocumentNotFoundException;
import com.purchasingpower.docqa.exception.IngestionException;
import com.purchasingpower.docqa.exception.ProviderException;
import com.purchasingpower.docqa.knowledge.EmbeddingService;
import com.purchasingpower.docqa.knowledge.TextChunker;
import com.purchasingpower.docqa.model.document.Document;
import com.purchasingpower.docqa.model.document.DocumentChunk;
import com.purchasingpower.docqa.model.document.IngestionResult;
import com.purchasingpower.docqa.repository.DocumentChunkRepository;
import com.purchasingpower.docqa.repository.DocumentRepository;
import com.purchasingpower.docqa.service.DocumentIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Ingestion pipeline: split, embed each passage, store it right away.
 *
 * Passages are committed one by one so a partially ingested document is already
 * searchable, and a failure part way keeps what was stored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentIngestionServiceImpl implements DocumentIngestionService {

    private final DocumentRepository documentRepository;
    private final DocumentChunkRepository chunkRepository;
    private final TextChunker textChunker;
    private final EmbeddingService embeddingService;

    @Override
    public IngestionResult ingest(Long documentId, String text) {
        long startTime = System.currentTimeMillis();
        Document document = documentRepository.findWithConversationById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));

        List<String> passages = textChunker.split(text);
        log.info("📄 Ingesting document {} ({}) of conversation {}: {} passages",
                documentId, document.getFilename(), document.getConversationId(), passages.size());

        int stored = 0;
        try {
            for (int i = 0; i < passages.size(); i++) {
                String passage = passages.get(i);
                List<Double> embedding = embeddingService.embed(passage);
                chunkRepository.save(DocumentChunk.of(document, i, passage, embedding));
                stored++;
            }
        } catch (ProviderException | DataAccessException e) {
            IngestionException failure = new IngestionException(documentId,
                    "Ingestion stopped at passage " + (stored + 1) + " of " + passages.size() + ": " + e.getMessage(), e);
            log.error("❌ {}", failure.getMessage());

            document.markFailed(stored, failure.getMessage());
            documentRepository.save(document);
            return IngestionResult.failure(documentId, stored, failure.getMessage(),
                    System.currentTimeMillis() - startTime);
        }

        document.markReady(stored);
        documentRepository.save(document);

        long duration = System.currentTimeMillis() - startTime;
        log.info("✅ Document {} ready: {} passages in {}ms", documentId, stored, duration);
        return IngestionResult.success(documentId, stored, duration);
    }
}
