package com.purchasingpower.docqa.repository;

import com.purchasingpower.docqa.model.document.DocumentChunk;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Chunk queries. Every read method takes the conversation id as a required key.
 * Extends the bare Spring Data marker so no findAll-style method is inherited.
 */
@Repository
public interface DocumentChunkRepository extends org.springframework.data.repository.Repository<DocumentChunk, Long> {

    DocumentChunk save(DocumentChunk chunk);

    @Query("SELECT c FROM DocumentChunk c JOIN FETCH c.document WHERE c.conversationId = :conversationId")
    List<DocumentChunk> findByConversationId(@Param("conversationId") String conversationId);

    @Query("SELECT c FROM DocumentChunk c JOIN FETCH c.document d "
            + "WHERE c.conversationId = :conversationId AND d.id IN :documentIds")
    List<DocumentChunk> findByConversationIdAndDocumentIds(@Param("conversationId") String conversationId,
                                                          @Param("documentIds") List<Long> documentIds);

    long countByConversationId(String conversationId);

    @Query("SELECT COUNT(c) FROM DocumentChunk c WHERE c.document.id = :documentId")
    long countByDocumentId(@Param("documentId") Long documentId);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM DocumentChunk c WHERE c.document.id = :documentId")
    int deleteByDocumentId(@Param("documentId") Long documentId);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM DocumentChunk c WHERE c.conversationId = :conversationId")
    int deleteByConversationId(@Param("conversationId") String conversationId);
}
