package com.gatewayadmin.admin.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Maps an inbound HTTP method + pattern to a backend RPC method.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Route(
        Long id,
        String httpMethod,
        String httpPattern,
        String backendName,     // Backend.name
        String backendService,  // e.g. user.v1.UserService
        String backendMethod,   // e.g. Login
        int timeoutMs,
        String description,
        boolean enabled,
        Instant createdAt,
        Instant updatedAt
) {

    public static final int DEFAULT_TIMEOUT_MS = 5000;

    public static final int HTTP_METHOD_MAX_LENGTH = 16;
    public static final int HTTP_PATTERN_MAX_LENGTH = 255;
    public static final int BACKEND_SERVICE_MAX_LENGTH = 255;
    public static final int BACKEND_METHOD_MAX_LENGTH = 128;
    public static final int DESCRIPTION_MAX_LENGTH = 512;

    public static Route draft(
            String httpMethod,
            String httpPattern,
            String backendName,
            String backendService,
            String backendMethod,
            int timeoutMs,
            String description,
            boolean enabled
    ) {
        return new Route(null, httpMethod, httpPattern, backendName, backendService,
                backendMethod, timeoutMs, description, enabled, null, null);
    }
}
