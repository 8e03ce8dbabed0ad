package com.purchasingpower.docqa.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class GeminiProperties {

    private String apiKey = "";

    @NotBlank
    private String chatModel = "gemini-1.5-flash";

    @NotBlank
    private String embeddingModel = "text-embedding-004";

    @NotBlank
    private String baseUrl = "https://generativelanguage.googleapis.com";

    @NotBlank
    private String apiVersion = "v1beta";

    private double temperature = 0.3;
}
