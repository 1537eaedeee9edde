package com.example.conversations.dto;

import com.example.conversations.entity.Message;
import com.example.conversations.entity.MessageRole;

import java.time.Instant;
import java.util.UUID;

/**
 * Outbound representation of a {@link Message}.
 */
public record MessageView(
        UUID id,
        UUID conversationId,
        MessageRole role,
        String text,
        Instant createdAt,
        Instant updatedAt
) {

    public static MessageView from(Message message) {
        return new MessageView(
                message.getId(),
                message.getConversation().getId(),
                message.getRole(),
                message.getText(),
                message.getCreatedAt(),
                message.getUpdatedAt());
    }
}
