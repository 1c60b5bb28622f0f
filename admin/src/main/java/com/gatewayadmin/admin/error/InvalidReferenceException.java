package com.gatewayadmin.admin.error;

/**
 * A route points at a backend that is missing or disabled.
 */
public class InvalidReferenceException extends ConfigException {

    private final String backendName;

    public InvalidReferenceException(String backendName) {
        super("backend not found or disabled: " + backendName);
        this.backendName = backendName;
    }

    public String backendName() {
        return backendName;
    }

    @Override
    public String code() {
        return "INVALID_REFERENCE";
    }
}
