package com.purchasingpower.docqa.repository;

import com.purchasingpower.docqa.model.conversation.Conversation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for managing Conversation entities.
 */
@Repository
public interface ConversationRepository extends JpaRepository<Conversation, String> {

    /**
     * Find all conversations for a user, most recently active first.
     */
    List<Conversation> findByUserIdOrderByUpdatedAtDesc(String userId);
}
