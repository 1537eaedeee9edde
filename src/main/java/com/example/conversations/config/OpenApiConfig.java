package com.example.conversations.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI document metadata and the API key security scheme referenced by the
 * mutating endpoints.
 */
@Configuration
public class OpenApiConfig {

    public static final String API_KEY_SCHEME = "APIKeyAuth";

    @Bean
    public OpenAPI conversationsOpenApi(ConversationsProperties properties) {
        return new OpenAPI()
                .info(new Info()
                        .title("Conversations API")
                        .description("Threaded conversations with an automatic rule-based assistant")
                        .version("v1"))
                .components(new Components()
                        .addSecuritySchemes(API_KEY_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name(properties.getSecurity().getHeaderName())
                                .description("Include the API key in the "
                                        + properties.getSecurity().getHeaderName() + " header.")));
    }
}
