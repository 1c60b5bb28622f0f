package com.gatewayadmin.admin.error;

import java.util.List;

public class ValidationException extends ConfigException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(message, List.of(message), null);
    }

    public ValidationException(List<String> errors) {
        super(String.join("; ", errors), errors, null);
    }

    @Override
    public String code() {
        return CODE;
    }
}
