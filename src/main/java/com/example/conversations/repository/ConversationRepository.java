package com.example.conversations.repository;

import com.example.conversations.entity.Conversation;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/**
 * Spring Data JPA repository for {@link com.example.conversations.entity.Conversation} entities.
 */
public interface ConversationRepository extends JpaRepository<Conversation, UUID> {
}
