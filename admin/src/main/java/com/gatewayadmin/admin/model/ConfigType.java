package com.gatewayadmin.admin.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum ConfigType {
    BACKEND("backend"),
    ROUTE("route");

    private final String value;

    ConfigType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<ConfigType> parse(String raw) {
        if (raw == null) return Optional.empty();
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (ConfigType t : values()) {
            if (t.value.equals(v)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
