package com.purchasingpower.docqa.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.docqa.configuration.AppProperties;
import com.purchasingpower.docqa.configuration.GatewayProperties;
import com.purchasingpower.docqa.exception.ProviderException;
import com.purchasingpower.docqa.model.conversation.MemoryTurn;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.purchasingpower.docqa.util.ExternalCallLogger.truncate;

/**
 * OpenAI-compatible gateway provider (GATEWAY variant).
 *
 * Talks to any endpoint exposing {@code /chat/completions} and {@code /embeddings}
 * with bearer authentication.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayProvider implements LLMProvider {

    private final AppProperties appProperties;

    private WebClient gatewayWebClient;

    @PostConstruct
    public void init() {
        GatewayProperties gateway = appProperties.getLlm().getGateway();
        this.gatewayWebClient = WebClient.builder()
                .baseUrl(gateway.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + gateway.getApiKey())
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build())
                .build();
    }

    @Override
    public ProviderKind getKind() {
        return ProviderKind.GATEWAY;
    }

    @Override
    public String getProviderName() {
        return "Gateway (" + appProperties.getLlm().getGateway().getChatModel() + ")";
    }

    @Override
    public String generate(String prompt, List<MemoryTurn> history) {
        GatewayProperties gateway = appProperties.getLlm().getGateway();
        log.info("🔵 [LLM REQUEST] Provider=Gateway, Model={}, HistoryTurns={}", gateway.getChatModel(), history.size());
        log.debug("🔵 [LLM REQUEST] Prompt length={}, Preview: {}", prompt.length(), truncate(prompt, 200));

        long startTime = System.currentTimeMillis();

        List<Map<String, Object>> messages = new ArrayList<>();
        messages.add(Map.of("role", "system", "content", OllamaProvider.SYSTEM_INSTRUCTION));
        for (MemoryTurn turn : history) {
            messages.add(Map.of("role", turn.getRole().value(), "content", turn.getContent()));
        }
        messages.add(Map.of("role", "user", "content", prompt));

        Map<String, Object> body = Map.of(
                "model", gateway.getChatModel(),
                "messages", messages,
                "temperature", gateway.getTemperature());

        try {
            JsonNode response = gatewayWebClient.post()
                    .uri("/chat/completions")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();

            String content = response == null ? "" : response.path("choices").path(0)
                    .path("message").path("content").asText("");
            long latency = System.currentTimeMillis() - startTime;

            log.info("🟢 [LLM RESPONSE] Provider=Gateway, Latency={}ms, ResponseLength={}", latency, content.length());
            log.debug("🟢 [LLM RESPONSE] Content: {}", truncate(content, 500));

            if (content.isBlank()) {
                throw new ProviderException(getProviderName(), "Gateway returned no choices", false);
            }
            return content;

        } catch (Exception e) {
            log.error("🔴 Gateway chat failed for model {}: {}", gateway.getChatModel(), e.getMessage());
            throw ProviderException.from(getProviderName(), "Gateway chat", e);
        }
    }

    @Override
    public List<Double> embed(String text) {
        String model = appProperties.getLlm().getGateway().getEmbeddingModel();
        log.debug("🔵 [EMBEDDING REQUEST] Provider=Gateway, Model={}, TextLength={}", model, text.length());

        try {
            JsonNode response = gatewayWebClient.post()
                    .uri("/embeddings")
                    .bodyValue(Map.of("model", model, "input", text))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();

            List<Double> embedding = new ArrayList<>();
            if (response != null) {
                for (JsonNode value : response.path("data").path(0).path("embedding")) {
                    embedding.add(value.asDouble());
                }
            }
            if (embedding.isEmpty()) {
                throw new ProviderException(getProviderName(), "Gateway returned an empty embedding", false);
            }
            log.debug("🟢 [EMBEDDING RESPONSE] Provider=Gateway, Dimensions={}", embedding.size());
            return embedding;

        } catch (Exception e) {
            log.error("🔴 Gateway embedding failed for model {}: {}", model, e.getMessage());
            throw ProviderException.from(getProviderName(), "Gateway embedding", e);
        }
    }
}
