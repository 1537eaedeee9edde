package com.example.conversations.controller;

import com.example.conversations.dto.ApiResponse;
import com.example.conversations.service.ServiceResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * Converts {@link ServiceResult} variants into enveloped HTTP responses.
 */
final class ResultResponses {

    private ResultResponses() {
    }

    static <T> ResponseEntity<ApiResponse<?>> toResponse(ServiceResult<T> result, HttpStatus successStatus,
                                                         String successMessage) {
        if (result instanceof ServiceResult.Ok<T> ok) {
            return ResponseEntity.status(successStatus)
                    .body(ApiResponse.success(successStatus, successMessage, ok.value()));
        }
        if (result instanceof ServiceResult.NotFound<T> notFound) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiResponse.error(HttpStatus.NOT_FOUND,
                            Map.of("detail", "No " + notFound.entity() + " matches the given query.")));
        }
        ServiceResult.Invalid<T> invalid = (ServiceResult.Invalid<T>) result;
        return ResponseEntity.badRequest()
                .body(ApiResponse.error(HttpStatus.BAD_REQUEST, invalid.errors()));
    }
}
