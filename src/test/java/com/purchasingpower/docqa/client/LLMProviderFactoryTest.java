package com.purchasingpower.docqa.client;

import com.purchasingpower.docqa.configuration.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LLMProviderFactoryTest {

    private AppProperties appProperties;
    private LLMProvider local;
    private LLMProvider hosted;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        local = mock(LLMProvider.class);
        hosted = mock(LLMProvider.class);
        when(local.getKind()).thenReturn(ProviderKind.LOCAL);
        when(hosted.getKind()).thenReturn(ProviderKind.HOSTED);
    }

    @Test
    @DisplayName("Embeddings follow the generation provider unless configured separately")
    void embeddingProvider_defaultsToGenerationProvider() {
        appProperties.getLlm().setProvider(ProviderKind.HOSTED);
        LLMProviderFactory factory = new LLMProviderFactory(appProperties, List.of(local, hosted));

        assertThat(factory.getProvider()).isSameAs(hosted);
        assertThat(factory.getEmbeddingProvider()).isSameAs(hosted);
    }

    @Test
    @DisplayName("Generation and embeddings can use different providers")
    void embeddingProvider_canDiffer() {
        appProperties.getLlm().setProvider(ProviderKind.HOSTED);
        appProperties.getLlm().setEmbeddingProvider(ProviderKind.LOCAL);
        LLMProviderFactory factory = new LLMProviderFactory(appProperties, List.of(local, hosted));

        assertThat(factory.getProvider()).isSameAs(hosted);
        assertThat(factory.getEmbeddingProvider()).isSameAs(local);
    }

    @Test
    void unregisteredProvider_throws() {
        LLMProviderFactory factory = new LLMProviderFactory(appProperties, List.of(local));

        assertThatThrownBy(() -> factory.getProvider(ProviderKind.GATEWAY))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("GATEWAY");
    }
}
