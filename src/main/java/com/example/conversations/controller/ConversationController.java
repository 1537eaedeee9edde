package com.example.conversations.controller;

import com.example.conversations.config.OpenApiConfig;
import com.example.conversations.dto.ApiResponse;
import com.example.conversations.dto.CreateConversationRequest;
import com.example.conversations.security.ApiKeyRequired;
import com.example.conversations.service.ConversationService;
import com.example.conversations.util.IdentifierGuard;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;

@RestController
@RequestMapping("/conversations")
@Tag(name = "Conversations", description = "Create, fetch and delete conversations")
public class ConversationController {

    private final ConversationService conversationService;

    public ConversationController(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    @Operation(
        summary = "Create a new conversation",
        description = "Create a new conversation with an optional title and required description."
    )
    @ApiResponses(value = {
        @io.swagger.v3.oas.annotations.responses.ApiResponse(
            responseCode = "201",
            description = "Conversation created successfully",
            content = @Content(
                mediaType = "application/json",
                examples = @ExampleObject(
                    value = """
                    {
                      "code": 201,
                      "message": "Conversation created successfully",
                      "data": {
                        "id": "550e8400-e29b-41d4-a716-446655440000",
                        "title": "My First Conversation",
                        "description": "A conversation about AI assistants",
                        "created_at": "2024-01-19T12:00:00Z",
                        "updated_at": "2024-01-19T12:00:00Z"
                      }
                    }
                    """
                )
            )
        ),
        @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error"),
        @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "401", description = "Authentication failed")
    })
    @SecurityRequirement(name = OpenApiConfig.API_KEY_SCHEME)
    @ApiKeyRequired
    @PostMapping
    public ResponseEntity<ApiResponse<?>> create(@RequestBody CreateConversationRequest body) {
        return ResultResponses.toResponse(
                conversationService.create(body), HttpStatus.CREATED, "Conversation created successfully");
    }

    @Operation(
        summary = "Get a conversation",
        description = "Retrieve a conversation by its unique identifier. Does not require authentication."
    )
    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<?>> get(
            @Parameter(description = "Unique identifier of the conversation")
            @PathVariable("id") String id) {
        return ResultResponses.toResponse(
                conversationService.get(IdentifierGuard.requireUuid(id, "id")),
                HttpStatus.OK, "Conversation retrieved successfully");
    }

    @Operation(
        summary = "Delete a conversation",
        description = "Delete a conversation and all its messages. This action cannot be undone."
    )
    @SecurityRequirement(name = OpenApiConfig.API_KEY_SCHEME)
    @ApiKeyRequired
    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<?>> delete(
            @Parameter(description = "Unique identifier of the conversation")
            @PathVariable("id") String id) {
        return ResultResponses.toResponse(
                conversationService.delete(IdentifierGuard.requireUuid(id, "id")),
                HttpStatus.OK, "Conversation deleted successfully");
    }
}
