package com.purchasingpower.docqa.repository;

import com.purchasingpower.docqa.model.document.DocumentMatch;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public interface DocumentMatchRepository extends JpaRepository<DocumentMatch, Long> {

    @Query("SELECT m FROM DocumentMatch m WHERE m.message.id = :messageId AND m.document.id = :documentId")
    Optional<DocumentMatch> findByMessageIdAndDocumentId(@Param("messageId") Long messageId,
                                                         @Param("documentId") Long documentId);

    @Query("SELECT m FROM DocumentMatch m JOIN FETCH m.document WHERE m.message.id = :messageId ORDER BY m.relevanceScore DESC, m.id ASC")
    List<DocumentMatch> findByMessageId(@Param("messageId") Long messageId);

    @Query("SELECT COUNT(m) FROM DocumentMatch m WHERE m.document.id = :documentId")
    long countByDocumentId(@Param("documentId") Long documentId);

    /**
     * Matches of a document, most recently recorded first.
     */
    @Query("SELECT m FROM DocumentMatch m JOIN FETCH m.message WHERE m.document.id = :documentId ORDER BY m.updatedAt DESC, m.id DESC")
    List<DocumentMatch> findRecentByDocumentId(@Param("documentId") Long documentId, Pageable pageable);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM DocumentMatch m WHERE m.message.id IN "
            + "(SELECT msg.id FROM ConversationMessage msg WHERE msg.conversation.conversationId = :conversationId)")
    int deleteByConversationId(@Param("conversationId") String conversationId);
}
