package com.example.conversations.exception;

/**
 * The API key header is missing or does not match the configured key.
 * The message is the same in both cases.
 */
public class AuthenticationFailedException extends ConversationsException {

    public static final String DETAIL = "Invalid API Key";

    public AuthenticationFailedException() {
        super(DETAIL);
    }
}
