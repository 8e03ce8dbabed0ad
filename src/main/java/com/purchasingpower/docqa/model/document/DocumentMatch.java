package com.purchasingpower.docqa.model.document;

import com.purchasingpower.docqa.model.conversation.ConversationMessage;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * DocumentMatch - records that a document contributed to an assistant answer.
 *
 * At most one row exists per (message, document); repeated recording updates
 * the passage and score in place.
 */
@Getter
@Setter
@Entity
@Table(name = "DOCUMENT_MATCHES",
        uniqueConstraints = @UniqueConstraint(name = "UK_MATCH_MESSAGE_DOCUMENT", columnNames = {"message_id", "document_id"}),
        indexes = @Index(name = "IX_MATCHES_DOCUMENT", columnList = "document_id, updated_at"))
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"message", "document", "matchedContent"})
public class DocumentMatch {

    public static final int MAX_MATCHED_CONTENT = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "message_id", nullable = false, updatable = false)
    private ConversationMessage message;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "document_id", nullable = false, updatable = false)
    private Document document;

    @Lob
    @Column(name = "matched_content", columnDefinition = "CLOB")
    private String matchedContent;

    /**
     * Similarity of the matched passage to the question, in [0, 1].
     */
    @Column(name = "relevance_score", nullable = false)
    private double relevanceScore;

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
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public Long getMessageId() {
        return message != null ? message.getId() : null;
    }

    public Long getDocumentId() {
        return document != null ? document.getId() : null;
    }
}
