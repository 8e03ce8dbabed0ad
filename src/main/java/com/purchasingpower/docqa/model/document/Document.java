package com.purchasingpower.docqa.model.document;

import com.purchasingpower.docqa.model.conversation.Conversation;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Document - extracted text uploaded into exactly one conversation.
 *
 * The conversation reference is mandatory: there is no shared or account-wide
 * document pool.
 */
@Getter
@Setter
@Entity
@Table(name = "DOCUMENTS", indexes = @Index(name = "IX_DOCUMENTS_CONVERSATION", columnList = "conversation_id"))
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"conversation", "content"})
public class Document {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "conversation_id", nullable = false, updatable = false)
    private Conversation conversation;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Column(name = "filename", nullable = false, length = 255)
    private String filename;

    @Lob
    @Column(name = "content", columnDefinition = "CLOB")
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private IngestionStatus status;

    @Column(name = "chunk_count", nullable = false)
    private int chunkCount;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    public void prePersist() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
        if (status == null) {
            status = IngestionStatus.PENDING;
        }
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public String getConversationId() {
        return conversation != null ? conversation.getConversationId() : null;
    }

    public void markReady(int chunks) {
        this.status = IngestionStatus.READY;
        this.chunkCount = chunks;
        this.failureReason = null;
    }

    public void markFailed(int chunks, String reason) {
        this.status = IngestionStatus.FAILED;
        this.chunkCount = chunks;
        this.failureReason = reason != null && reason.length() > 1000 ? reason.substring(0, 1000) : reason;
    }

    public void markPending() {
        this.status = IngestionStatus.PENDING;
        this.chunkCount = 0;
        this.failureReason = null;
    }
}
