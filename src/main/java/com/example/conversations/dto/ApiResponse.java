package com.example.conversations.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

/**
 * Uniform wire shape for every response.
 *
 * <p>Success: {@code {code, message, data}}. Failure: {@code {code, message, data: null, errors}}.
 * {@code code} always mirrors the HTTP status.</p>
 *
 * @param <T> payload type
 */
public record ApiResponse<T>(
        int code,
        String message,
        T data,
        @JsonInclude(JsonInclude.Include.NON_NULL) Object errors
) {

    public static <T> ApiResponse<T> success(HttpStatus status, String message, T data) {
        return new ApiResponse<>(status.value(), message, data, null);
    }

    public static ApiResponse<Void> error(HttpStatusCode status, Object errors) {
        return new ApiResponse<>(status.value(), messageFor(status.value()), null, errors);
    }

    /**
     * Fixed summary for an error status.
     */
    public static String messageFor(int status) {
        return switch (status) {
            case 400 -> "Validation error";
            case 401 -> "Authentication failed";
            case 403 -> "Permission denied";
            case 404 -> "Resource not found";
            case 405 -> "Method not allowed";
            case 500 -> "Internal server error";
            default -> "An error occurred";
        };
    }
}
