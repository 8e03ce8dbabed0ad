package com.purchasingpower.docqa.service.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.docqa.configuration.AppProperties;
import com.purchasingpower.docqa.exception.GenerationException;
import com.purchasingpower.docqa.exception.ProviderException;
import com.purchasingpower.docqa.exception.RetrievalException;
import com.purchasingpower.docqa.knowledge.EmbeddingService;
import com.purchasingpower.docqa.knowledge.RetrievalResult;
import com.purchasingpower.docqa.knowledge.ScoredChunk;
import com.purchasingpower.docqa.knowledge.VectorIndex;
import com.purchasingpower.docqa.model.conversation.Conversation;
import com.purchasingpower.docqa.model.conversation.MemoryTurn;
import com.purchasingpower.docqa.model.document.Document;
import com.purchasingpower.docqa.model.qa.AnswerMetadata;
import com.purchasingpower.docqa.model.qa.AnswerMode;
import com.purchasingpower.docqa.model.qa.AskRequest;
import com.purchasingpower.docqa.model.qa.AskResponse;
import com.purchasingpower.docqa.model.qa.QaPhase;
import com.purchasingpower.docqa.model.qa.QaState;
import com.purchasingpower.docqa.model.qa.QaStatus;
import com.purchasingpower.docqa.model.qa.RecordedExchange;
import com.purchasingpower.docqa.model.qa.SourceAttribution;
import com.purchasingpower.docqa.repository.DocumentRepository;
import com.purchasingpower.docqa.service.ContextBuilder;
import com.purchasingpower.docqa.service.ContextBuilder.BuiltContext;
import com.purchasingpower.docqa.service.ConversationMemory;
import com.purchasingpower.docqa.service.ConversationSequencer;
import com.purchasingpower.docqa.service.ConversationService;
import com.purchasingpower.docqa.service.GenerationService;
import com.purchasingpower.docqa.service.PromptLibraryService;
import com.purchasingpower.docqa.service.QaOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.purchasingpower.docqa.util.ExternalCallLogger.snippet;

/**
 * Question answering as an explicit state machine.
 *
 * <pre>
 * INIT -> LOAD_DOCUMENTS -> NO_DOCUMENTS  -> AGENT_MODE ----------------> GENERATE
 *                        -> HAS_DOCUMENTS -> RETRIEVE -> BUILD_CONTEXT -> GENERATE
 *                                                     -> AGENT_MODE (nothing relevant / retrieval failed)
 * GENERATE -> PERSIST_MATCHES -> COMPLETE, any step may end in FAILED
 * </pre>
 *
 * Embedding and generation run without holding any lock. The commit of a run
 * waits for earlier runs of the same conversation, then writes both messages and
 * all matches in one transaction before memory is updated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QaOrchestratorImpl implements QaOrchestrator {

    /**
     * Phrases showing the model asked the user for document contents instead of answering.
     */
    static final List<String> UPLOAD_REQUEST_SIGNALS = List.of(
            "please provide",
            "please paste",
            "i need the text",
            "provide the content",
            "upload the",
            "send the",
            "paste the",
            "can't access files",
            "i don't have access to"
    );

    private final AppProperties appProperties;
    private final ConversationService conversationService;
    private final DocumentRepository documentRepository;
    private final EmbeddingService embeddingService;
    private final VectorIndex vectorIndex;
    private final ContextBuilder contextBuilder;
    private final PromptLibraryService promptLibrary;
    private final GenerationService generationService;
    private final ConversationMemory memory;
    private final ConversationSequencer sequencer;

    @Override
    public AskResponse ask(AskRequest request) {
        Preconditions.checkArgument(request != null, "request is required");
        Preconditions.checkArgument(request.getQuestion() != null && !request.getQuestion().isBlank(),
                "question is required");

        Conversation conversation = request.getConversationId() == null || request.getConversationId().isBlank()
                ? conversationService.createConversation(request.getUserId(), null)
                : conversationService.requireConversation(request.getConversationId());

        QaState state = new QaState(conversation.getConversationId(), request.getQuestion().strip(),
                request.getDocumentName());
        log.info("❓ [QA] conversation={} question='{}'", state.getConversationId(), snippet(state.getQuestion(), 80));

        try (ConversationSequencer.Ticket ticket = sequencer.issue(state.getConversationId())) {
            try {
                loadDocuments(state);
            } catch (DataAccessException e) {
                log.error("❌ [QA] Could not load documents of conversation {}: {}",
                        state.getConversationId(), e.getMessage());
                return fail(state, "Loading the conversation's documents failed: " + e.getMessage());
            }

            BuiltContext context = null;
            if (state.getPhase() == QaPhase.HAS_DOCUMENTS) {
                context = retrieve(state);
            } else {
                state.transitionTo(QaPhase.AGENT_MODE);
            }

            if (state.getPhase() == QaPhase.AGENT_MODE) {
                state.setMode(AnswerMode.AGENT);
                state.setPrompt(promptLibrary.render(PromptLibraryService.AGENT_ANSWER,
                        Map.of("question", state.getQuestion())));
            }

            state.transitionTo(QaPhase.GENERATE);
            try {
                state.setAnswer(generate(state));
            } catch (GenerationException e) {
                log.error("❌ [QA] Generation failed for conversation {} after {} attempt(s): {}",
                        state.getConversationId(), e.getAttempts(), e.getMessage());
                return fail(state, "Answer generation failed: " + e.getMessage());
            }

            if (state.getMode() == AnswerMode.AGENT) {
                context = null;
            }
            List<ScoredChunk> citations = context != null ? bestPassagePerDocument(context.getPassages()) : List.of();

            state.transitionTo(QaPhase.PERSIST_MATCHES);
            RecordedExchange recorded;
            try {
                recorded = sequencer.runInTurn(ticket, () -> {
                    RecordedExchange exchange = conversationService.recordExchange(state.getConversationId(),
                            state.getQuestion(), state.getAnswer(), state.getMode().value(), citations);
                    memory.appendExchange(state.getConversationId(), state.getQuestion(), state.getAnswer());
                    return exchange;
                });
            } catch (DataAccessException | IllegalStateException e) {
                log.error("❌ [QA] Could not store the answer for conversation {}: {}",
                        state.getConversationId(), e.getMessage());
                return fail(state, "Storing the answer failed: " + e.getMessage());
            }

            state.transitionTo(QaPhase.COMPLETE);
            log.info("✅ [QA] conversation={} mode={} sources={} phases={}",
                    state.getConversationId(), state.getMode().value(), citations.size(), state.getHistory());
            return complete(state, recorded, context, citations);
        }
    }

    private void loadDocuments(QaState state) {
        state.transitionTo(QaPhase.LOAD_DOCUMENTS);

        List<Document> documents = documentRepository.findByConversationId(state.getConversationId());
        if (state.hasDocumentFilter() && !documents.isEmpty()) {
            List<Document> named = documents.stream()
                    .filter(d -> d.getFilename().equalsIgnoreCase(state.getDocumentName().strip()))
                    .toList();
            if (named.isEmpty()) {
                state.setNote("Document '" + state.getDocumentName() + "' is not part of this conversation; "
                        + "answered from general knowledge.");
            }
            documents = named;
        }
        state.setDocuments(documents);

        if (documents.isEmpty()) {
            log.info("📭 [QA] No documents in conversation {}, using agent mode", state.getConversationId());
            state.transitionTo(QaPhase.NO_DOCUMENTS);
        } else {
            log.info("📚 [QA] {} document(s) in conversation {}", documents.size(), state.getConversationId());
            state.transitionTo(QaPhase.HAS_DOCUMENTS);
        }
    }

    private BuiltContext retrieve(QaState state) {
        state.transitionTo(QaPhase.RETRIEVE);
        int maxK = appProperties.getRetrieval().getMaxK();

        RetrievalResult result;
        try {
            List<Double> queryVector = embeddingService.embed(state.getQuestion());
            result = state.hasDocumentFilter()
                    ? vectorIndex.search(state.getConversationId(), queryVector, maxK,
                            state.getDocuments().stream().map(Document::getId).toList())
                    : vectorIndex.search(state.getConversationId(), queryVector, maxK);
        } catch (RetrievalException | ProviderException e) {
            log.warn("⚠️ [QA] Retrieval failed for conversation {}, degrading to agent mode: {}",
                    state.getConversationId(), e.getMessage());
            state.setDegraded(true);
            state.setNote("Document search is unavailable right now; answered from general knowledge.");
            state.transitionTo(QaPhase.AGENT_MODE);
            return null;
        }

        RetrievalResult relevant = result.withMinScore(appProperties.getRetrieval().getMinScore());
        state.setRetrieval(relevant);
        log.info("🔍 [QA] {} of {} retrieved passages are relevant ({} document(s), {} candidates)",
                relevant.size(), result.size(), relevant.distinctDocumentCount(), result.getCandidateCount());

        if (relevant.isEmpty()) {
            state.setNote("No passage in this conversation's documents matched the question; "
                    + "answered from general knowledge.");
            state.transitionTo(QaPhase.AGENT_MODE);
            return null;
        }

        state.transitionTo(QaPhase.BUILD_CONTEXT);
        BuiltContext context = contextBuilder.build(relevant.getChunks());
        state.setContext(context.getText());
        state.setMode(AnswerMode.RAG);

        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("question", state.getQuestion());
        variables.put("context", context.getText());
        variables.put("documentCount", context.getDocumentNames().size());
        variables.put("documentList", String.join(", ", context.getDocumentNames()));
        state.setPrompt(promptLibrary.render(PromptLibraryService.RAG_ANSWER, variables));
        return context;
    }

    private String generate(QaState state) {
        List<MemoryTurn> history = memory.recent(state.getConversationId(), appProperties.getMemory().getTurnsInPrompt());
        String answer = generationService.generate(state.getPrompt(), history);

        if (asksForUpload(answer)) {
            log.info("🔁 [QA] Model asked for document content; running general-knowledge fallback");
            try {
                String fallback = generationService.generate(
                        promptLibrary.render(PromptLibraryService.GENERAL_KNOWLEDGE_FALLBACK,
                                Map.of("question", state.getQuestion())),
                        List.of());
                if (fallback != null && !fallback.isBlank()) {
                    answer = fallback;
                    if (state.getMode() == AnswerMode.RAG) {
                        // the replacement answer saw no passages, so nothing is cited
                        state.setMode(AnswerMode.AGENT);
                        state.setNote("The documents did not answer the question; answered from general knowledge.");
                    }
                }
            } catch (GenerationException e) {
                log.warn("⚠️ [QA] General-knowledge fallback failed, keeping first answer: {}", e.getMessage());
            }
        }
        return answer;
    }

    static boolean asksForUpload(String answer) {
        if (answer == null) {
            return false;
        }
        String lower = answer.toLowerCase(Locale.ROOT);
        return UPLOAD_REQUEST_SIGNALS.stream().anyMatch(lower::contains);
    }

    /**
     * First (best) passage of each document, in ranking order.
     */
    static List<ScoredChunk> bestPassagePerDocument(List<ScoredChunk> passages) {
        Map<Long, ScoredChunk> best = new LinkedHashMap<>();
        for (ScoredChunk passage : passages) {
            best.putIfAbsent(passage.getDocumentId(), passage);
        }
        return new ArrayList<>(best.values());
    }

    private AskResponse complete(QaState state, RecordedExchange recorded, BuiltContext context,
                                 List<ScoredChunk> citations) {
        int snippetChars = appProperties.getContext().getSnippetChars();
        List<SourceAttribution> sources = citations.stream()
                .map(c -> SourceAttribution.builder()
                        .documentId(c.getDocumentId())
                        .documentName(c.getDocumentName())
                        .passage(snippet(c.getContent(), snippetChars))
                        .score(c.getScore())
                        .build())
                .toList();

        return AskResponse.builder()
                .conversationId(state.getConversationId())
                .messageId(recorded.getAssistantMessageId())
                .status(QaStatus.COMPLETED)
                .answer(state.getAnswer())
                .sources(new ArrayList<>(sources))
                .metadata(AnswerMetadata.builder()
                        .mode(state.getMode())
                        .numSources(sources.size())
                        .numPassages(context != null ? context.getPassages().size() : 0)
                        .contextLength(context != null ? context.length() : 0)
                        .degraded(state.isDegraded())
                        .note(state.getNote())
                        .build())
                .build();
    }

    private AskResponse fail(QaState state, String error) {
        state.setError(error);
        state.transitionTo(QaPhase.FAILED);
        AskResponse response = AskResponse.failed(state.getConversationId(), error);
        response.setMetadata(AnswerMetadata.builder()
                .mode(state.getMode())
                .degraded(state.isDegraded())
                .note(state.getNote())
                .build());
        return response;
    }
}
