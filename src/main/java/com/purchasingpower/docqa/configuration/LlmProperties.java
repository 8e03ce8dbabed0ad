package com.purchasingpower.docqa.configuration;

import com.purchasingpower.docqa.client.ProviderKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

@Data
public class LlmProperties {

    /**
     * Provider used for answer generation.
     */
    @NotNull
    private ProviderKind provider = ProviderKind.LOCAL;

    /**
     * Provider used for embeddings. Falls back to {@link #provider} when unset.
     */
    private ProviderKind embeddingProvider;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private OllamaProperties ollama = new OllamaProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GeminiProperties gemini = new GeminiProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GatewayProperties gateway = new GatewayProperties();

    public ProviderKind getEffectiveEmbeddingProvider() {
        return embeddingProvider != null ? embeddingProvider : provider;
    }
}
