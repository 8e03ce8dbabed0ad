package com.purchasingpower.docqa.repository;

import com.purchasingpower.docqa.model.conversation.ConversationMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ConversationMessageRepository extends JpaRepository<ConversationMessage, Long> {

    /**
     * Messages of a conversation in conversation order.
     */
    @Query("SELECT m FROM ConversationMessage m WHERE m.conversation.conversationId = :conversationId ORDER BY m.position ASC")
    List<ConversationMessage> findByConversationIdOrdered(@Param("conversationId") String conversationId);

    /**
     * Latest messages of a conversation, newest first. Used to seed conversation memory.
     */
    @Query("SELECT m FROM ConversationMessage m WHERE m.conversation.conversationId = :conversationId ORDER BY m.position DESC")
    List<ConversationMessage> findLatest(@Param("conversationId") String conversationId, Pageable pageable);

    /**
     * Highest position used in a conversation, or -1 when it has no messages yet.
     */
    @Query("SELECT COALESCE(MAX(m.position), -1) FROM ConversationMessage m WHERE m.conversation.conversationId = :conversationId")
    int findMaxPosition(@Param("conversationId") String conversationId);

    long countByConversationConversationId(String conversationId);
}
