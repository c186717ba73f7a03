package com.example.chatsync.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeIn;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API docs split by resource. Callers identify themselves with the {@code X-User-Id} header.
 */
@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "Chat Sync API",
                version = "1.0",
                description = "Chats, members, messages and read receipts. Committed changes are pushed to chat channels."),
        security = @SecurityRequirement(name = "caller"))
@SecurityScheme(name = "caller", type = SecuritySchemeType.APIKEY, in = SecuritySchemeIn.HEADER, paramName = "X-User-Id")
public class OpenApiConfig {

    @Bean
    public GroupedOpenApi chatsApi() {
        return GroupedOpenApi.builder()
                .group("chats")
                .pathsToMatch("/api/chats/**")
                .build();
    }

    @Bean
    public GroupedOpenApi messagesApi() {
        return GroupedOpenApi.builder()
                .group("messages")
                .pathsToMatch("/api/messages/**", "/api/chats/*/messages")
                .build();
    }
}
