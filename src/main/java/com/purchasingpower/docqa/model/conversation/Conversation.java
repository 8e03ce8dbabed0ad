package com.purchasingpower.docqa.model.conversation;

import com.purchasingpower.docqa.model.document.Document;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Conversation - the isolation boundary for documents, messages and memory.
 *
 * Every document uploaded into a conversation, every chunk derived from it and
 * every message exchanged belongs to exactly one conversation. Deleting the
 * conversation removes all of them.
 */
@Getter
@Setter
@Entity
@Table(name = "CONVERSATIONS", indexes = @Index(name = "IX_CONVERSATIONS_USER", columnList = "user_id"))
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"documents", "messages"})
public class Conversation {

    public static final String DEFAULT_TITLE = "New Conversation";

    private static final int TITLE_LENGTH = 50;

    @Id
    @Column(name = "conversation_id", nullable = false, length = 100)
    private String conversationId;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Builder.Default
    @OneToMany(mappedBy = "conversation", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    private List<Document> documents = new ArrayList<>();

    @Builder.Default
    @OneToMany(mappedBy = "conversation", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("position ASC")
    private List<ConversationMessage> messages = new ArrayList<>();

    // ================================================================
    // Lifecycle Hooks
    // ================================================================

    @PrePersist
    public void prePersist() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
        if (title == null || title.isBlank()) {
            title = DEFAULT_TITLE;
        }
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = LocalDateTime.now();
    }

    // ================================================================
    // Helper Methods
    // ================================================================

    /**
     * Replace the default title with the opening question.
     */
    public void titleFromFirstQuestion(String question) {
        if (!DEFAULT_TITLE.equals(title) || question == null || question.isBlank()) {
            return;
        }
        String trimmed = question.strip();
        this.title = trimmed.length() > TITLE_LENGTH
                ? trimmed.substring(0, TITLE_LENGTH) + "..."
                : trimmed;
    }

    public void touch() {
        this.updatedAt = LocalDateTime.now();
    }
}
