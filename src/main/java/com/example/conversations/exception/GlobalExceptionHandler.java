package com.example.conversations.exception;

import com.example.conversations.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.util.List;
import java.util.Map;

/**
 * Global exception handler for the REST API boundary.
 *
 * <p>This is the only place where exceptions become wire errors. Every response uses the
 * {@link ApiResponse} envelope; unexpected failures are logged in full and reported to the
 * client with a fixed message.</p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    static final String UNEXPECTED_DETAIL = "An unexpected error occurred. Please try again later.";

    /**
     * Client error - malformed path identifier (HTTP 400).
     */
    @ExceptionHandler(InvalidIdentifierException.class)
    ResponseEntity<ApiResponse<Void>> handleInvalidIdentifier(InvalidIdentifierException ex) {
        log.warn("Rejected identifier: {}={}", ex.getParameterName(), ex.getRejectedValue());
        return respond(HttpStatus.BAD_REQUEST, Map.of(ex.getParameterName(), List.of(ex.getMessage())));
    }

    /**
     * Missing or wrong API key (HTTP 401). The detail does not say which.
     */
    @ExceptionHandler(AuthenticationFailedException.class)
    ResponseEntity<ApiResponse<Void>> handleAuthenticationFailed(AuthenticationFailedException ex) {
        return respond(HttpStatus.UNAUTHORIZED, Map.of("detail", AuthenticationFailedException.DETAIL));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception ex) {
        log.error("Unhandled exception: {}", ex.getClass().getSimpleName(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, Map.of("detail", UNEXPECTED_DETAIL));
    }

    /**
     * Framework exceptions (unsupported method, unreadable body, unknown route, ...)
     * keep their status but are rewritten into the envelope.
     */
    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
            Exception ex, Object body, HttpHeaders headers, HttpStatusCode statusCode, WebRequest request) {
        String detail;
        if (statusCode.is5xxServerError()) {
            log.error("Request failed: {}", ex.getClass().getSimpleName(), ex);
            detail = UNEXPECTED_DETAIL;
        } else {
            log.warn("Request rejected with {}: {}", statusCode.value(), ex.getClass().getSimpleName());
            detail = body instanceof ProblemDetail problem && problem.getDetail() != null
                    ? problem.getDetail()
                    : ApiResponse.messageFor(statusCode.value());
        }
        return ResponseEntity.status(statusCode)
                .headers(headers)
                .body(ApiResponse.error(statusCode, Map.of("detail", detail)));
    }

    private static ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, Object errors) {
        return ResponseEntity.status(status).body(ApiResponse.error(status, errors));
    }
}
