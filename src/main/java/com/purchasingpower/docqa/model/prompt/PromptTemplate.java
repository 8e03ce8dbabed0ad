package com.purchasingpower.docqa.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from YAML under {@code classpath:prompts/}.
 *
 * YAML structure:
 * <pre>
 * name: rag-answer
 * version: 1.0
 * systemPrompt: |
 *   You are an AI assistant...
 * userPrompt: |
 *   Question: {{question}}
 * </pre>
 *
 * @see com.purchasingpower.docqa.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String description;
    private String systemPrompt;
    private String userPrompt;
}
