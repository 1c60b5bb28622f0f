package com.gatewayadmin.admin.error;

import java.util.List;

/**
 * Root of the configuration error taxonomy. Each subclass is exactly one
 * outcome category; the HTTP layer maps {@link #code()} to a status.
 */
public abstract class ConfigException extends RuntimeException {

    private final List<String> details;

    protected ConfigException(String message) {
        this(message, List.of(), null);
    }

    protected ConfigException(String message, List<String> details, Throwable cause) {
        super(message, cause);
        this.details = details == null ? List.of() : List.copyOf(details);
    }

    public abstract String code();

    public List<String> details() {
        return details;
    }
}
