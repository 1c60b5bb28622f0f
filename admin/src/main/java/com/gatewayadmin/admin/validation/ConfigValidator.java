package com.gatewayadmin.admin.validation;

import com.gatewayadmin.admin.error.ValidationException;
import com.gatewayadmin.admin.model.Backend;
import com.gatewayadmin.admin.model.Route;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Required-field and length checks, run against fully merged entities.
 * Lengths match the column widths of the tables.
 */
@Component
public class ConfigValidator {

    public List<String> validate(Backend b) {
        if (b == null) return List.of("backend is null");
        List<String> errs = new ArrayList<>();
        if (isBlank(b.name())) errs.add("name is required");
        if (isBlank(b.addr())) errs.add("addr is required");
        tooLong(errs, "name", b.name(), Backend.NAME_MAX_LENGTH);
        tooLong(errs, "addr", b.addr(), Backend.ADDR_MAX_LENGTH);
        tooLong(errs, "description", b.description(), Backend.DESCRIPTION_MAX_LENGTH);
        return errs;
    }

    public List<String> validate(Route r) {
        if (r == null) return List.of("route is null");
        List<String> errs = new ArrayList<>();
        if (isBlank(r.httpMethod())) errs.add("http_method is required");
        if (isBlank(r.httpPattern())) errs.add("http_pattern is required");
        if (isBlank(r.backendName())) errs.add("backend_name is required");
        if (isBlank(r.backendService())) errs.add("backend_service is required");
        if (isBlank(r.backendMethod())) errs.add("backend_method is required");
        tooLong(errs, "http_method", r.httpMethod(), Route.HTTP_METHOD_MAX_LENGTH);
        tooLong(errs, "http_pattern", r.httpPattern(), Route.HTTP_PATTERN_MAX_LENGTH);
        tooLong(errs, "backend_name", r.backendName(), Backend.NAME_MAX_LENGTH);
        tooLong(errs, "backend_service", r.backendService(), Route.BACKEND_SERVICE_MAX_LENGTH);
        tooLong(errs, "backend_method", r.backendMethod(), Route.BACKEND_METHOD_MAX_LENGTH);
        tooLong(errs, "description", r.description(), Route.DESCRIPTION_MAX_LENGTH);
        return errs;
    }

    public Backend require(Backend b) {
        throwIfAny(validate(b));
        return b;
    }

    public Route require(Route r) {
        throwIfAny(validate(r));
        return r;
    }

    private static void throwIfAny(List<String> errs) {
        if (!errs.isEmpty()) throw new ValidationException(errs);
    }

    private static void tooLong(List<String> errs, String field, String value, int max) {
        if (value != null && value.length() > max) errs.add(field + " too long (max " + max + ")");
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
