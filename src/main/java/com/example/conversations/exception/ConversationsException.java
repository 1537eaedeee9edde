package com.example.conversations.exception;

/**
 * Base type for exceptions raised at the request boundary of the service.
 * Each subclass maps to one HTTP status in {@link GlobalExceptionHandler}.
 */
public abstract class ConversationsException extends RuntimeException {

    protected ConversationsException(String message) {
        super(message);
    }
}
