package com.purchasingpower.docqa.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * OpenAI-compatible gateway (OpenRouter, LiteLLM, vLLM, ...).
 */
@Data
public class GatewayProperties {

    private String apiKey = "";

    @NotBlank
    private String baseUrl = "https://openrouter.ai/api/v1";

    @NotBlank
    private String chatModel = "openai/gpt-4o-mini";

    @NotBlank
    private String embeddingModel = "openai/text-embedding-3-small";

    private double temperature = 0.3;
}
