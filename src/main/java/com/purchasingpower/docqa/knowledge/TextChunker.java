package com.purchasingpower.docqa.knowledge;

import com.purchasingpower.docqa.configuration.AppProperties;
import com.purchasingpower.docqa.configuration.IngestionProperties;
import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.document.splitter.DocumentSplitters;
import dev.langchain4j.data.segment.TextSegment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Splits document text into passages of bounded size.
 *
 * Uses LangChain4j's recursive splitter, which prefers paragraph boundaries, then
 * lines, sentences and finally words, so passages rarely cut through a sentence.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TextChunker {

    private final AppProperties appProperties;

    public List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        IngestionProperties ingestion = appProperties.getIngestion();
        int overlap = Math.min(ingestion.getChunkOverlap(), ingestion.getChunkSize() / 2);
        DocumentSplitter splitter = DocumentSplitters.recursive(ingestion.getChunkSize(), overlap);

        List<String> passages = splitter.split(Document.from(text)).stream()
                .map(TextSegment::text)
                .filter(passage -> !passage.isBlank())
                .toList();

        log.debug("✂️ Split {} chars into {} passages (size={}, overlap={})",
                text.length(), passages.size(), ingestion.getChunkSize(), overlap);
        return passages;
    }
}
