package com.gatewayadmin.admin.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * One immutable audit entry. {@code oldValue} is absent for CREATE and
 * {@code newValue} is absent for DELETE.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConfigHistory(
        Long id,
        ConfigType configType,
        Long configId,
        Operation operation,
        JsonNode oldValue,
        JsonNode newValue,
        String operator,
        Instant createdAt
) {

    /** Longer operator strings are cut to this length before they are stored. */
    public static final int OPERATOR_MAX_LENGTH = 128;

    public static ConfigHistory entry(
            ConfigType configType,
            Long configId,
            Operation operation,
            JsonNode oldValue,
            JsonNode newValue,
            String operator
    ) {
        return new ConfigHistory(null, configType, configId, operation, oldValue, newValue, operator, null);
    }
}
