package com.example.conversations.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link MessageRole} as its lowercase wire value.
 */
@Converter(autoApply = true)
public class MessageRoleConverter implements AttributeConverter<MessageRole, String> {

    @Override
    public String convertToDatabaseColumn(MessageRole role) {
        return role == null ? null : role.value();
    }

    @Override
    public MessageRole convertToEntityAttribute(String column) {
        if (column == null) {
            return null;
        }
        return MessageRole.fromValue(column)
                .orElseThrow(() -> new IllegalStateException("Unknown message role in database: " + column));
    }
}
