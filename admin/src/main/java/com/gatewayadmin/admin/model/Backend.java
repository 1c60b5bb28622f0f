package com.gatewayadmin.admin.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * A named upstream service endpoint. The name is the lookup key and never
 * changes after creation.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Backend(
        Long id,
        String name,
        String addr,          // host:port
        String description,
        boolean enabled,
        Instant createdAt,
        Instant updatedAt
) {

    // column widths of the backends table
    public static final int NAME_MAX_LENGTH = 128;
    public static final int ADDR_MAX_LENGTH = 255;
    public static final int DESCRIPTION_MAX_LENGTH = 512;

    /** Unsaved backend; id and timestamps are assigned by the store. */
    public static Backend draft(String name, String addr, String description, boolean enabled) {
        return new Backend(null, name, addr, description, enabled, null, null);
    }
}
