package com.example.focusroom.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * WebSocket endpoint settings, bound from {@code app.websocket.*}.
 *
 * @param path           endpoint path
 * @param allowedOrigins origin patterns accepted on the handshake; empty accepts any origin
 * @param debugOpen      accept any origin regardless of {@code allowedOrigins}
 */
@Validated
@ConfigurationProperties(prefix = "app.websocket")
public record WebSocketProperties(
        @DefaultValue("/ws") @NotBlank String path,
        @DefaultValue("http://localhost:3000") List<String> allowedOrigins,
        @DefaultValue("false") boolean debugOpen
) {

    /** Patterns handed to the handshake origin check. */
    public String[] originPatterns() {
        List<String> origins = allowedOrigins == null ? List.of() : allowedOrigins.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
        if (debugOpen || origins.isEmpty()) return new String[] {"*"};
        return origins.toArray(String[]::new);
    }
}
