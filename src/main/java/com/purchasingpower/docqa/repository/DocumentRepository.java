package com.purchasingpower.docqa.repository;

import com.purchasingpower.docqa.model.document.Document;
import com.purchasingpower.docqa.model.document.IngestionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Document lookups are always scoped by conversation.
 */
@Repository
public interface DocumentRepository extends JpaRepository<Document, Long> {

    @Query("SELECT d FROM Document d WHERE d.conversation.conversationId = :conversationId ORDER BY d.id ASC")
    List<Document> findByConversationId(@Param("conversationId") String conversationId);

    @Query("SELECT d FROM Document d WHERE d.conversation.conversationId = :conversationId AND d.filename = :filename ORDER BY d.id ASC")
    List<Document> findByConversationIdAndFilename(@Param("conversationId") String conversationId,
                                                   @Param("filename") String filename);

    /**
     * Document with its conversation loaded, for work done outside a persistence context.
     */
    @Query("SELECT d FROM Document d JOIN FETCH d.conversation WHERE d.id = :documentId")
    Optional<Document> findWithConversationById(@Param("documentId") Long documentId);

    @Query("SELECT COUNT(d) FROM Document d WHERE d.conversation.conversationId = :conversationId AND d.status = :status")
    long countByConversationIdAndStatus(@Param("conversationId") String conversationId,
                                        @Param("status") IngestionStatus status);
}
