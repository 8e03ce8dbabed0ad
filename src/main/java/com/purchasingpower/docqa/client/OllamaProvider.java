package com.purchasingpower.docqa.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.docqa.configuration.AppProperties;
import com.purchasingpower.docqa.configuration.OllamaProperties;
import com.purchasingpower.docqa.exception.ProviderException;
import com.purchasingpower.docqa.model.conversation.MemoryTurn;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static com.purchasingpower.docqa.util.ExternalCallLogger.truncate;

/**
 * Ollama provider implementation (LOCAL variant).
 * Chat goes through the /api/chat endpoint; embeddings through LangChain4j's
 * OllamaEmbeddingModel.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OllamaProvider implements LLMProvider {

    static final String SYSTEM_INSTRUCTION =
            "You are a helpful assistant answering questions inside a document chat. Answer in plain prose.";

    private final AppProperties appProperties;

    private WebClient ollamaWebClient;
    private EmbeddingModel embeddingModel;

    @PostConstruct
    public void init() {
        OllamaProperties ollama = appProperties.getLlm().getOllama();
        int timeoutSeconds = ollama.getTimeoutSeconds();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10000)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));

        this.ollamaWebClient = WebClient.builder()
                .baseUrl(ollama.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();

        // Single attempt: retries are applied by ProviderCallExecutor
        this.embeddingModel = OllamaEmbeddingModel.builder()
                .baseUrl(ollama.getBaseUrl())
                .modelName(ollama.getEmbeddingModel())
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .maxRetries(1)
                .logRequests(false)
                .logResponses(false)
                .build();
    }

    @Override
    public ProviderKind getKind() {
        return ProviderKind.LOCAL;
    }

    @Override
    public String getProviderName() {
        return "Ollama (" + appProperties.getLlm().getOllama().getChatModel() + ")";
    }

    @Override
    public String generate(String prompt, List<MemoryTurn> history) {
        OllamaProperties ollama = appProperties.getLlm().getOllama();
        log.info("🔵 [LLM REQUEST] Provider=Ollama, Model={}, HistoryTurns={}", ollama.getChatModel(), history.size());
        log.debug("🔵 [LLM REQUEST] Prompt length={}, Preview: {}", prompt.length(), truncate(prompt, 200));

        long startTime = System.currentTimeMillis();

        List<Map<String, Object>> messages = new ArrayList<>();
        messages.add(Map.of("role", "system", "content", SYSTEM_INSTRUCTION));
        for (MemoryTurn turn : history) {
            messages.add(Map.of("role", turn.getRole().value(), "content", turn.getContent()));
        }
        messages.add(Map.of("role", "user", "content", prompt));

        Map<String, Object> body = Map.of(
                "model", ollama.getChatModel(),
                "messages", messages,
                "stream", false,
                "options", Map.of(
                        "num_ctx", ollama.getNumCtx(),
                        "temperature", 0.2
                )
        );

        try {
            JsonNode response = ollamaWebClient.post()
                    .uri("/api/chat")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();

            String content = response == null ? "" : response.path("message").path("content").asText("");
            long latency = System.currentTimeMillis() - startTime;

            log.info("🟢 [LLM RESPONSE] Provider=Ollama, Latency={}ms, ResponseLength={}", latency, content.length());
            log.debug("🟢 [LLM RESPONSE] Content: {}", truncate(content, 500));

            if (content.isBlank()) {
                throw new ProviderException(getProviderName(), "Ollama returned an empty answer", true);
            }
            return content;

        } catch (Exception e) {
            log.error("🔴 Ollama chat failed for model {}: {}", ollama.getChatModel(), e.getMessage());
            throw ProviderException.from(getProviderName(), "Ollama chat", e);
        }
    }

    @Override
    public List<Double> embed(String text) {
        log.debug("🔵 [EMBEDDING REQUEST] Provider=Ollama, TextLength={}", text.length());

        try {
            Response<Embedding> response = embeddingModel.embed(text);
            List<Double> embedding = toDoubleList(response.content());
            log.debug("🟢 [EMBEDDING RESPONSE] Provider=Ollama, Dimensions={}", embedding.size());
            return embedding;
        } catch (Exception e) {
            log.error("🔴 Ollama embedding failed for model {}: {}",
                    appProperties.getLlm().getOllama().getEmbeddingModel(), e.getMessage());
            throw ProviderException.from(getProviderName(), "Ollama embedding", e);
        }
    }

    private List<Double> toDoubleList(Embedding embedding) {
        float[] vector = embedding.vector();
        List<Double> result = new ArrayList<>(vector.length);
        for (float value : vector) {
            result.add((double) value);
        }
        return result;
    }
}
