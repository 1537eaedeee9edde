package com.example.conversations.dto;

import com.example.conversations.entity.Conversation;

import java.time.Instant;
import java.util.UUID;

/**
 * Outbound representation of a {@link Conversation}.
 */
public record ConversationView(
        UUID id,
        String title,
        String description,
        Instant createdAt,
        Instant updatedAt
) {

    public static ConversationView from(Conversation conversation) {
        return new ConversationView(
                conversation.getId(),
                conversation.getTitle(),
                conversation.getDescription(),
                conversation.getCreatedAt(),
                conversation.getUpdatedAt());
    }
}
