package com.purchasingpower.docqa.client;

import com.purchasingpower.docqa.configuration.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Factory for selecting the active LLM provider.
 *
 * Routes generation and embedding calls to the configured {@link ProviderKind}.
 * The two may differ, e.g. local embeddings with hosted generation.
 */
@Slf4j
@Component
public class LLMProviderFactory {

    private final AppProperties appProperties;
    private final Map<ProviderKind, LLMProvider> providers = new EnumMap<>(ProviderKind.class);

    public LLMProviderFactory(AppProperties appProperties, List<LLMProvider> availableProviders) {
        this.appProperties = appProperties;
        for (LLMProvider provider : availableProviders) {
            providers.put(provider.getKind(), provider);
        }
    }

    @PostConstruct
    public void init() {
        log.info("🚀 LLM Provider configured: {}", appProperties.getLlm().getProvider());
        log.info("   Active provider: {}", getProvider().getProviderName());
        log.info("   Embedding provider: {}", getEmbeddingProvider().getProviderName());
    }

    /**
     * Get the provider used for answer generation.
     */
    public LLMProvider getProvider() {
        return getProvider(appProperties.getLlm().getProvider());
    }

    /**
     * Get provider for embeddings specifically.
     */
    public LLMProvider getEmbeddingProvider() {
        return getProvider(appProperties.getLlm().getEffectiveEmbeddingProvider());
    }

    public LLMProvider getProvider(ProviderKind kind) {
        LLMProvider provider = providers.get(kind);
        if (provider == null) {
            throw new IllegalArgumentException("Unknown LLM provider: " + kind);
        }
        return provider;
    }
}
