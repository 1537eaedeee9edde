package com.example.conversations.controller;

import java.util.UUID;

import com.example.conversations.config.ConversationsProperties;
import com.example.conversations.config.OpenApiConfig;
import com.example.conversations.dto.ApiResponse;
import com.example.conversations.dto.CreateMessageRequest;
import com.example.conversations.dto.PageView;
import com.example.conversations.security.ApiKeyRequired;
import com.example.conversations.service.MessageService;
import com.example.conversations.service.pagination.MessageFilter;
import com.example.conversations.service.pagination.PageParams;
import com.example.conversations.util.IdentifierGuard;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;

@RestController
@RequestMapping("/conversations/{id}/messages")
@Tag(name = "Messages", description = "Messages of a conversation, with automatic assistant replies")
public class MessageController {

    private final MessageService messageService;
    private final ConversationsProperties properties;

    public MessageController(MessageService messageService, ConversationsProperties properties) {
        this.messageService = messageService;
        this.properties = properties;
    }

    @Operation(
        summary = "List messages in a conversation",
        description = "Messages ordered by creation time, optionally filtered by text (case-insensitive) "
                + "and role. Results are paginated. Does not require authentication."
    )
    @GetMapping
    public ResponseEntity<ApiResponse<?>> list(
            @Parameter(description = "Unique identifier of the conversation")
            @PathVariable("id") String id,
            @Parameter(description = "Search query matched against message text, case-insensitive")
            @RequestParam(name = "q", required = false) String q,
            @Parameter(description = "Filter by role", schema = @Schema(allowableValues = {"user", "assistant"}))
            @RequestParam(name = "role", required = false) String role,
            @Parameter(description = "Page number (default: 1)")
            @RequestParam(name = "page", required = false) String page,
            @Parameter(description = "Number of items per page (default: 10)")
            @RequestParam(name = "page_size", required = false) String pageSize) {

        UUID conversationId = IdentifierGuard.requireUuid(id, "id");
        PageParams pageParams = PageParams.parse(page, pageSize, properties.getPagination().getDefaultPageSize());

        return ResultResponses.toResponse(
                messageService.list(conversationId, MessageFilter.of(q, role), pageParams)
                        .map(result -> PageView.of(result, MessageController::linkForPage)),
                HttpStatus.OK, "Messages retrieved successfully");
    }

    @Operation(
        summary = "Create a message",
        description = "Add a message to a conversation. A 'user' message also gets an automatic "
                + "assistant reply stored after it."
    )
    @SecurityRequirement(name = OpenApiConfig.API_KEY_SCHEME)
    @ApiKeyRequired
    @PostMapping
    public ResponseEntity<ApiResponse<?>> create(
            @Parameter(description = "Unique identifier of the conversation")
            @PathVariable("id") String id,
            @RequestBody CreateMessageRequest body) {
        return ResultResponses.toResponse(
                messageService.create(IdentifierGuard.requireUuid(id, "id"), body),
                HttpStatus.CREATED, "Message created successfully");
    }

    @Operation(summary = "Get a message", description = "Does not require authentication.")
    @GetMapping("/{message_id}")
    public ResponseEntity<ApiResponse<?>> get(
            @PathVariable("id") String id,
            @PathVariable("message_id") String messageId) {
        UUID conversationId = IdentifierGuard.requireUuid(id, "id");
        return ResultResponses.toResponse(
                messageService.get(conversationId, IdentifierGuard.requireUuid(messageId, "message_id")),
                HttpStatus.OK, "Message retrieved successfully");
    }

    @Operation(summary = "Delete a message", description = "This action cannot be undone.")
    @SecurityRequirement(name = OpenApiConfig.API_KEY_SCHEME)
    @ApiKeyRequired
    @DeleteMapping("/{message_id}")
    public ResponseEntity<ApiResponse<?>> delete(
            @PathVariable("id") String id,
            @PathVariable("message_id") String messageId) {
        UUID conversationId = IdentifierGuard.requireUuid(id, "id");
        return ResultResponses.toResponse(
                messageService.delete(conversationId, IdentifierGuard.requireUuid(messageId, "message_id")),
                HttpStatus.OK, "Message deleted successfully");
    }

    // page 1 is the default, so its link carries no page parameter
    private static String linkForPage(int page) {
        ServletUriComponentsBuilder builder = ServletUriComponentsBuilder.fromCurrentRequest();
        if (page == PageParams.FIRST_PAGE) {
            builder.replaceQueryParam("page");
        } else {
            builder.replaceQueryParam("page", page);
        }
        return builder.toUriString();
    }
}
