package com.purchasingpower.docqa.knowledge.impl;

import com.purchasingpower.docqa.client.LLMProvider;
import com.purchasingpower.docqa.client.LLMProviderFactory;
import com.purchasingpower.docqa.knowledge.EmbeddingService;
import com.purchasingpower.docqa.util.ProviderCallExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * EmbeddingService backed by the configured embedding provider.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderEmbeddingService implements EmbeddingService {

    private final LLMProviderFactory providerFactory;
    private final ProviderCallExecutor callExecutor;

    @Override
    public List<Double> embed(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Text cannot be empty");
        }

        LLMProvider provider = providerFactory.getEmbeddingProvider();
        log.debug("🔷 Generating embedding via {} (length: {})", provider.getProviderName(), text.length());

        List<Double> embedding = callExecutor.execute(provider.getProviderName(), "embedding",
                () -> provider.embed(text));
        log.debug("✅ Generated embedding ({} dimensions)", embedding.size());
        return embedding;
    }
}
