package com.purchasingpower.docqa.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.docqa.configuration.AppProperties;
import com.purchasingpower.docqa.configuration.GeminiProperties;
import com.purchasingpower.docqa.exception.ProviderException;
import com.purchasingpower.docqa.model.conversation.MemoryTurn;
import com.purchasingpower.docqa.model.conversation.MessageRole;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.purchasingpower.docqa.util.ExternalCallLogger.truncate;

/**
 * Gemini provider implementation (HOSTED variant).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeminiProvider implements LLMProvider {

    private final AppProperties appProperties;

    private WebClient geminiWebClient;

    @PostConstruct
    public void init() {
        GeminiProperties gemini = appProperties.getLlm().getGemini();
        // API key goes in a header so it never shows up in URLs or access logs
        this.geminiWebClient = WebClient.builder()
                .baseUrl(gemini.getBaseUrl())
                .defaultHeader("x-goog-api-key", gemini.getApiKey())
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build())
                .build();
    }

    private String getApiUrl(String model, String action) {
        return String.format("/%s/models/%s:%s",
                appProperties.getLlm().getGemini().getApiVersion(), model, action);
    }

    @Override
    public ProviderKind getKind() {
        return ProviderKind.HOSTED;
    }

    @Override
    public String getProviderName() {
        return "Gemini (" + appProperties.getLlm().getGemini().getChatModel() + ")";
    }

    @Override
    public String generate(String prompt, List<MemoryTurn> history) {
        GeminiProperties gemini = appProperties.getLlm().getGemini();
        log.info("🔵 [LLM REQUEST] Provider=Gemini, Model={}, HistoryTurns={}", gemini.getChatModel(), history.size());
        log.debug("🔵 [LLM REQUEST] Prompt length={}, Preview: {}", prompt.length(), truncate(prompt, 200));

        long startTime = System.currentTimeMillis();

        List<Map<String, Object>> contents = new ArrayList<>();
        for (MemoryTurn turn : history) {
            // Gemini names the assistant side "model"
            String role = turn.getRole() == MessageRole.ASSISTANT ? "model" : "user";
            contents.add(Map.of("role", role, "parts", List.of(Map.of("text", turn.getContent()))));
        }
        contents.add(Map.of("role", "user", "parts", List.of(Map.of("text", prompt))));

        Map<String, Object> body = Map.of(
                "systemInstruction", Map.of("parts", List.of(Map.of("text", OllamaProvider.SYSTEM_INSTRUCTION))),
                "contents", contents,
                "generationConfig", Map.of("temperature", gemini.getTemperature()));

        try {
            JsonNode response = geminiWebClient.post()
                    .uri(getApiUrl(gemini.getChatModel(), "generateContent"))
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();

            String content = response == null ? "" : response.path("candidates").path(0)
                    .path("content").path("parts").path(0).path("text").asText("");
            long latency = System.currentTimeMillis() - startTime;

            log.info("🟢 [LLM RESPONSE] Provider=Gemini, Latency={}ms, ResponseLength={}", latency, content.length());
            log.debug("🟢 [LLM RESPONSE] Content: {}", truncate(content, 500));

            if (content.isBlank()) {
                throw new ProviderException(getProviderName(), "Gemini returned no candidates", false);
            }
            return content;

        } catch (Exception e) {
            log.error("🔴 Gemini chat failed for model {}: {}", gemini.getChatModel(), e.getMessage());
            throw ProviderException.from(getProviderName(), "Gemini chat", e);
        }
    }

    @Override
    public List<Double> embed(String text) {
        String model = appProperties.getLlm().getGemini().getEmbeddingModel();
        log.debug("🔵 [EMBEDDING REQUEST] Provider=Gemini, Model={}, TextLength={}", model, text.length());

        Map<String, Object> body = Map.of(
                "model", "models/" + model,
                "content", Map.of("parts", List.of(Map.of("text", text))));

        try {
            JsonNode response = geminiWebClient.post()
                    .uri(getApiUrl(model, "embedContent"))
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();

            List<Double> embedding = new ArrayList<>();
            if (response != null) {
                for (JsonNode value : response.path("embedding").path("values")) {
                    embedding.add(value.asDouble());
                }
            }
            if (embedding.isEmpty()) {
                throw new ProviderException(getProviderName(), "Gemini returned an empty embedding", false);
            }
            log.debug("🟢 [EMBEDDING RESPONSE] Provider=Gemini, Dimensions={}", embedding.size());
            return embedding;

        } catch (Exception e) {
            log.error("🔴 Gemini embedding failed for model {}: {}", model, e.getMessage());
            throw ProviderException.from(getProviderName(), "Gemini embedding", e);
        }
    }
}
