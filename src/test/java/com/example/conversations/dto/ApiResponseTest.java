package com.example.conversations.dto;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ApiResponseTest {

    @Test
    void successMirrorsStatusAndCarriesData() {
        ApiResponse<String> response = ApiResponse.success(HttpStatus.CREATED, "Created", "payload");

        assertThat(response.code()).isEqualTo(201);
        assertThat(response.message()).isEqualTo("Created");
        assertThat(response.data()).isEqualTo("payload");
        assertThat(response.errors()).isNull();
    }

    @Test
    void errorUsesFixedMessagePerStatus() {
        assertThat(ApiResponse.error(HttpStatus.BAD_REQUEST, Map.of()).message()).isEqualTo("Validation error");
        assertThat(ApiResponse.error(HttpStatus.UNAUTHORIZED, Map.of()).message()).isEqualTo("Authentication failed");
        assertThat(ApiResponse.error(HttpStatus.FORBIDDEN, Map.of()).message()).isEqualTo("Permission denied");
        assertThat(ApiResponse.error(HttpStatus.NOT_FOUND, Map.of()).message()).isEqualTo("Resource not found");
        assertThat(ApiResponse.error(HttpStatus.METHOD_NOT_ALLOWED, Map.of()).message()).isEqualTo("Method not allowed");
        assertThat(ApiResponse.error(HttpStatus.INTERNAL_SERVER_ERROR, Map.of()).message())
            .isEqualTo("Internal server error");
    }

    @Test
    void unmappedStatusGetsGenericMessage() {
        ApiResponse<Void> response = ApiResponse.error(HttpStatusCode.valueOf(418), Map.of("detail", "teapot"));

        assertThat(response.code()).isEqualTo(418);
        assertThat(response.message()).isEqualTo("An error occurred");
        assertThat(response.data()).isNull();
        assertThat(response.errors()).isEqualTo(Map.of("detail", "teapot"));
    }
}
