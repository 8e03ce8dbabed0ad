package com.purchasingpower.docqa.model.conversation;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * ConversationMessage - one question or answer inside a conversation.
 *
 * Assistant messages carry generation metadata: the answering mode
 * ("rag" or "agent") and how many documents were cited.
 */
@Getter
@Setter
@Entity
@Table(name = "CONVERSATION_MESSAGES",
        indexes = @Index(name = "IX_MESSAGES_CONVERSATION", columnList = "conversation_id, message_position"))
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "conversation")
public class ConversationMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "conversation_id", nullable = false)
    private Conversation conversation;

    @Enumerated(EnumType.STRING)
    @Column(name = "message_role", nullable = false, length = 20)
    private MessageRole role;

    @Lob
    @Column(name = "content", columnDefinition = "CLOB", nullable = false)
    private String content;

    /**
     * Ordinal position within the conversation, starting at 0.
     */
    @Column(name = "message_position", nullable = false)
    private int position;

    @Column(name = "answer_mode", length = 10)
    private String mode;

    @Column(name = "source_count")
    private Integer sourceCount;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public String getConversationId() {
        return conversation != null ? conversation.getConversationId() : null;
    }
}
