package com.purchasingpower.docqa.service.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.docqa.configuration.AppProperties;
import com.purchasingpower.docqa.configuration.MemoryProperties;
import com.purchasingpower.docqa.model.conversation.ConversationMessage;
import com.purchasingpower.docqa.model.conversation.MemoryTurn;
import com.purchasingpower.docqa.model.conversation.MessageRole;
import com.purchasingpower.docqa.repository.ConversationMessageRepository;
import com.purchasingpower.docqa.service.ConversationMemory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Conversation memory held in process, keyed by conversation id.
 *
 * A conversation's window is created on first use and seeded from its latest
 * persisted messages, so dialogue context survives a restart.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InMemoryConversationMemory implements ConversationMemory {

    private final AppProperties appProperties;
    private final ConversationMessageRepository messageRepository;

    private final Map<String, Deque<MemoryTurn>> windows = new ConcurrentHashMap<>();

    @Override
    public void append(String conversationId, MessageRole role, String content) {
        Deque<MemoryTurn> window = window(conversationId);
        synchronized (window) {
            window.addLast(new MemoryTurn(role, content != null ? content : ""));
            trim(window);
        }
    }

    @Override
    public void appendExchange(String conversationId, String question, String answer) {
        Deque<MemoryTurn> window = window(conversationId);
        synchronized (window) {
            window.addLast(MemoryTurn.user(question));
            window.addLast(MemoryTurn.assistant(answer));
            trim(window);
        }
    }

    @Override
    public List<MemoryTurn> read(String conversationId) {
        Deque<MemoryTurn> window = window(conversationId);
        synchronized (window) {
            return List.copyOf(window);
        }
    }

    @Override
    public List<MemoryTurn> recent(String conversationId, int maxTurns) {
        // seeds the window even when no turns are wanted, so the next commit is not replayed from storage
        List<MemoryTurn> all = read(conversationId);
        if (maxTurns <= 0) {
            return List.of();
        }
        return all.subList(Math.max(0, all.size() - maxTurns), all.size());
    }

    @Override
    public void clear(String conversationId) {
        if (windows.remove(conversationId) != null) {
            log.debug("🧹 Cleared memory of conversation {}", conversationId);
        }
    }

    private Deque<MemoryTurn> window(String conversationId) {
        Preconditions.checkArgument(conversationId != null && !conversationId.isBlank(),
                "conversationId is required for memory access");
        return windows.computeIfAbsent(conversationId, this::seed);
    }

    private Deque<MemoryTurn> seed(String conversationId) {
        int maxTurns = appProperties.getMemory().getMaxTurns();
        List<ConversationMessage> latest = messageRepository.findLatest(conversationId, PageRequest.of(0, maxTurns));

        Deque<MemoryTurn> window = new ArrayDeque<>();
        // newest first from the repository
        for (int i = latest.size() - 1; i >= 0; i--) {
            ConversationMessage message = latest.get(i);
            window.addLast(new MemoryTurn(message.getRole(), message.getContent()));
        }
        trim(window);

        if (!window.isEmpty()) {
            log.info("💭 Seeded memory of conversation {} with {} persisted turns", conversationId, window.size());
        }
        return window;
    }

    private void trim(Deque<MemoryTurn> window) {
        MemoryProperties limits = appProperties.getMemory();
        while (window.size() > limits.getMaxTurns()) {
            window.removeFirst();
        }
        int total = window.stream().mapToInt(MemoryTurn::length).sum();
        while (window.size() > 1 && total > limits.getMaxChars()) {
            total -= window.removeFirst().length();
        }
    }
}
