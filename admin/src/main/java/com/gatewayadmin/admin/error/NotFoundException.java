package com.gatewayadmin.admin.error;

public class NotFoundException extends ConfigException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException backend(String name) {
        return new NotFoundException("backend not found: " + name);
    }

    public static NotFoundException route(long id) {
        return new NotFoundException("route not found: " + id);
    }

    @Override
    public String code() {
        return "NOT_FOUND";
    }
}
