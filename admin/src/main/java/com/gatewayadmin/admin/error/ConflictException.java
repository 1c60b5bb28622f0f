package com.gatewayadmin.admin.error;

public class ConflictException extends ConfigException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, null, cause);
    }

    @Override
    public String code() {
        return "CONFLICT";
    }
}
