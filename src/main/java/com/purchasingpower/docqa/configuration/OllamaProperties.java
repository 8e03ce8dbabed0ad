package com.purchasingpower.docqa.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OllamaProperties {

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    @NotBlank
    private String chatModel = "llama3.1:8b";

    @NotBlank
    private String embeddingModel = "mxbai-embed-large";

    @Min(1024)
    private int numCtx = 8192;

    @Min(1)
    private int timeoutSeconds = 120;
}
