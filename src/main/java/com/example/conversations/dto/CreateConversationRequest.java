package com.example.conversations.dto;

import com.example.conversations.entity.Conversation;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of {@code POST /conversations}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateConversationRequest {

    @Schema(description = "Optional title for the conversation", example = "My First Conversation")
    @Size(max = Conversation.TITLE_MAX_LENGTH,
            message = "Ensure this field has no more than {max} characters.")
    private String title;

    @Schema(description = "Description of the conversation (required, max 500 characters)",
            example = "A conversation about AI assistants", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotNull(message = "This field is required.")
    @Size.List({
            @Size(min = 1, message = "This field may not be blank."),
            @Size(max = Conversation.DESCRIPTION_MAX_LENGTH,
                    message = "Ensure this field has no more than {max} characters.")
    })
    private String description;
}
