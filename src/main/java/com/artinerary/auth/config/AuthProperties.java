package com.artinerary.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param userIdHeader header in which the auth gateway forwards the authenticated user id
 */
@ConfigurationProperties(prefix = "artinerary.auth")
public record AuthProperties(
        String userIdHeader
) {

    public AuthProperties {
        if (userIdHeader == null || userIdHeader.isBlank()) {
            userIdHeader = "X-User-Id";
        }
    }
}
