package com.example.conversations.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

/**
 * Settings bound from the {@code conversations.*} block of {@code application.yml}.
 * Bound once at startup and only read afterwards.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "conversations")
public class ConversationsProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Security security = new Security();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Pagination pagination = new Pagination();

    /**
     * A warning is recorded when deleting a conversation removes more messages than this.
     */
    @Min(0)
    private int cascadeWarnThreshold = 100;

    @Data
    public static class Security {

        /** Shared credential required by every mutating endpoint. */
        @NotBlank(message = "conversations.security.api-key is required")
        private String apiKey;

        @NotBlank
        private String headerName = "X-API-Key";
    }

    @Data
    public static class Pagination {

        @Min(1)
        private int defaultPageSize = 10;
    }
}
