package com.example.conversations.exception;

import lombok.Getter;

/**
 * A path identifier is not a canonical UUID string.
 */
@Getter
public class InvalidIdentifierException extends ConversationsException {

    private final String parameterName;
    private final String rejectedValue;

    public InvalidIdentifierException(String parameterName, String rejectedValue) {
        super("Invalid UUID format: '" + rejectedValue + "'");
        this.parameterName = parameterName;
        this.rejectedValue = rejectedValue;
    }
}
