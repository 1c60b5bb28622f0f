package com.gatewayadmin.admin.merge;

import com.fasterxml.jackson.databind.JsonNode;
import com.gatewayadmin.admin.config.GatewayAdminProperties;
import com.gatewayadmin.admin.error.ValidationException;
import com.gatewayadmin.admin.model.Backend;
import com.gatewayadmin.admin.model.Route;
import com.gatewayadmin.admin.validation.ConfigValidator;
import org.springframework.stereotype.Component;

/**
 * Turns untyped JSON payloads into typed entities.
 *
 * <p>The payload is read by key presence: an omitted field keeps the existing
 * value, a present field (explicit {@code false}, {@code 0} and {@code null}
 * included) replaces it. Identity fields (ids, backend name) always come from
 * the existing record. Required-field validation runs on the merged result.
 */
@Component
public class UpdateMergePolicy {

    public static final String NAME = "name";
    public static final String ADDR = "addr";
    public static final String DESCRIPTION = "description";
    public static final String ENABLED = "enabled";

    public static final String HTTP_METHOD = "http_method";
    public static final String HTTP_PATTERN = "http_pattern";
    public static final String BACKEND_NAME = "backend_name";
    public static final String BACKEND_SERVICE = "backend_service";
    public static final String BACKEND_METHOD = "backend_method";
    public static final String TIMEOUT_MS = "timeout_ms";

    private final ConfigValidator validator;
    private final int defaultTimeoutMs;

    public UpdateMergePolicy(ConfigValidator validator, GatewayAdminProperties props) {
        this.validator = validator;
        this.defaultTimeoutMs = props.getRoute().getDefaultTimeoutMs();
    }

    // ---- backends ----

    /** Creation payload; {@code enabled} defaults to true when omitted. */
    public Backend newBackend(JsonNode payload) {
        Fields f = Fields.of(payload);
        Backend b = Backend.draft(
                f.text(NAME, null),
                f.text(ADDR, null),
                f.text(DESCRIPTION, null),
                f.bool(ENABLED, true)
        );
        return validator.require(b);
    }

    public Backend mergeBackend(Backend existing, JsonNode payload) {
        Fields f = Fields.of(payload);
        Backend merged = new Backend(
                existing.id(),
                existing.name(),
                f.text(ADDR, existing.addr()),
                f.text(DESCRIPTION, existing.description()),
                f.bool(ENABLED, existing.enabled()),
                existing.createdAt(),
                existing.updatedAt()
        );
        return validator.require(merged);
    }

    // ---- routes ----

    public Route newRoute(JsonNode payload) {
        Fields f = Fields.of(payload);
        Route r = Route.draft(
                f.text(HTTP_METHOD, null),
                f.text(HTTP_PATTERN, null),
                f.text(BACKEND_NAME, null),
                f.text(BACKEND_SERVICE, null),
                f.text(BACKEND_METHOD, null),
                normalizeTimeout(f.integer(TIMEOUT_MS, null)),
                f.text(DESCRIPTION, null),
                f.bool(ENABLED, true)
        );
        return validator.require(r);
    }

    public Route mergeRoute(Route existing, JsonNode payload) {
        Fields f = Fields.of(payload);
        Route merged = new Route(
                existing.id(),
                f.text(HTTP_METHOD, existing.httpMethod()),
                f.text(HTTP_PATTERN, existing.httpPattern()),
                f.text(BACKEND_NAME, existing.backendName()),
                f.text(BACKEND_SERVICE, existing.backendService()),
                f.text(BACKEND_METHOD, existing.backendMethod()),
                normalizeTimeout(f.integer(TIMEOUT_MS, existing.timeoutMs())),
                f.text(DESCRIPTION, existing.description()),
                f.bool(ENABLED, existing.enabled()),
                existing.createdAt(),
                existing.updatedAt()
        );
        return validator.require(merged);
    }

    private int normalizeTimeout(Integer timeoutMs) {
        return (timeoutMs == null || timeoutMs <= 0) ? defaultTimeoutMs : timeoutMs;
    }

    /**
     * Presence-aware view over a JSON object payload.
     */
    private record Fields(JsonNode node) {

        static Fields of(JsonNode payload) {
            if (payload == null || !payload.isObject()) {
                throw new ValidationException("payload must be a JSON object");
            }
            return new Fields(payload);
        }

        String text(String key, String fallback) {
            if (!node.has(key)) return fallback;
            JsonNode v = node.get(key);
            if (v.isNull()) return null;
            if (!v.isTextual()) throw new ValidationException(key + " must be a string");
            return v.asText();
        }

        boolean bool(String key, boolean fallback) {
            if (!node.has(key)) return fallback;
            JsonNode v = node.get(key);
            if (!v.isBoolean()) throw new ValidationException(key + " must be a boolean");
            return v.booleanValue();
        }

        Integer integer(String key, Integer fallback) {
            if (!node.has(key)) return fallback;
            JsonNode v = node.get(key);
            if (v.isNull()) return null;
            if (!v.isIntegralNumber() || !v.canConvertToInt()) {
                throw new ValidationException(key + " must be an integer");
            }
            return v.intValue();
        }
    }
}
