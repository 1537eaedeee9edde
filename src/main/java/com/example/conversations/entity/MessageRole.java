package com.example.conversations.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Author of a {@link Message}. The lowercase {@link #value()} is used both on the
 * wire and in the {@code messages.role} column.
 */
public enum MessageRole {
    USER("user"),
    ASSISTANT("assistant");

    private final String value;

    MessageRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * @param value wire value, matched exactly
     * @return the role, or empty when {@code value} is not one of the known roles
     */
    public static Optional<MessageRole> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(role -> role.value.equals(value))
                .findFirst();
    }
}
