package com.example.conversations.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of {@code POST /conversations/{id}/messages}. The conversation comes from the path.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateMessageRequest {

    @Schema(description = "Content of the message (required)", example = "Hello, how are you?",
            requiredMode = Schema.RequiredMode.REQUIRED)
    @NotNull(message = "This field is required.")
    @Size(min = 1, message = "This field may not be blank.")
    private String text;

    @Schema(description = "Role of the message sender", allowableValues = {"user", "assistant"},
            defaultValue = "user")
    @Pattern(regexp = "user|assistant", message = "Must be one of: user, assistant.")
    private String role;
}
