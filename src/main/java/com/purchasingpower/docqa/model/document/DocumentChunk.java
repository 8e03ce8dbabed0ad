package com.purchasingpower.docqa.model.document;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * DocumentChunk - one embedded passage of a document.
 *
 * {@code conversationId} duplicates the owning document's conversation so the
 * vector index can filter by conversation without a join. It is only ever set
 * by {@link #of}, which copies it from the document.
 */
@Getter
@Entity
@Table(name = "DOCUMENT_CHUNKS", indexes = {
        @Index(name = "IX_CHUNKS_CONVERSATION", columnList = "conversation_id"),
        @Index(name = "IX_CHUNKS_DOCUMENT", columnList = "document_id, chunk_index")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@ToString(exclude = {"document", "embedding", "content"})
public class DocumentChunk {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "document_id", nullable = false, updatable = false)
    private Document document;

    @Column(name = "conversation_id", nullable = false, length = 100, updatable = false)
    private String conversationId;

    @Column(name = "chunk_index", nullable = false)
    private int chunkIndex;

    @Lob
    @Column(name = "content", columnDefinition = "CLOB", nullable = false)
    private String content;

    @Lob
    @Convert(converter = EmbeddingConverter.class)
    @Column(name = "embedding", columnDefinition = "CLOB", nullable = false)
    private List<Double> embedding;

    @Column(name = "dimension", nullable = false)
    private int dimension;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public static DocumentChunk of(Document document, int chunkIndex, String content, List<Double> embedding) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(document.getConversation(), "document.conversation");
        Objects.requireNonNull(embedding, "embedding");

        DocumentChunk chunk = new DocumentChunk();
        chunk.document = document;
        chunk.conversationId = document.getConversation().getConversationId();
        chunk.chunkIndex = chunkIndex;
        chunk.content = content;
        chunk.embedding = List.copyOf(embedding);
        chunk.dimension = embedding.size();
        return chunk;
    }

    @PrePersist
    public void prePersist() {
        if (!Objects.equals(conversationId, document.getConversationId())) {
            throw new IllegalStateException("Chunk conversation " + conversationId
                    + " does not match document conversation " + document.getConversationId());
        }
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public Long getDocumentId() {
        return document != null ? document.getId() : null;
    }
}
