package com.gatewayadmin.admin.web;

import com.gatewayadmin.admin.error.ApiError;
import com.gatewayadmin.admin.error.ConfigException;
import com.gatewayadmin.admin.error.ConflictException;
import com.gatewayadmin.admin.error.InvalidReferenceException;
import com.gatewayadmin.admin.error.NotFoundException;
import com.gatewayadmin.admin.error.StorageException;
import com.gatewayadmin.admin.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Maps the error taxonomy to HTTP statuses. Body: {"error": {...}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ConfigException.class)
    public ResponseEntity<Map<String, ApiError>> handleConfig(ConfigException e) {
        HttpStatus status = statusOf(e);
        if (e instanceof StorageException) {
            log.error("storage failure: {}", e.getMessage(), e);
            return error(status, ApiError.of(e.code(), "internal server error"));
        }
        return error(status, new ApiError(e.code(), e.getMessage(), e.details()));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Map<String, ApiError>> handleBadRequest(Exception e) {
        String message = (e instanceof MethodArgumentTypeMismatchException m)
                ? "invalid " + m.getName()
                : "invalid json";
        return error(HttpStatus.BAD_REQUEST, ApiError.of(ValidationException.CODE, message));
    }

    static HttpStatus statusOf(ConfigException e) {
        if (e instanceof NotFoundException) return HttpStatus.NOT_FOUND;
        if (e instanceof ConflictException) return HttpStatus.CONFLICT;
        if (e instanceof InvalidReferenceException) return HttpStatus.BAD_REQUEST;
        if (e instanceof ValidationException) return HttpStatus.BAD_REQUEST;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static ResponseEntity<Map<String, ApiError>> error(HttpStatus status, ApiError err) {
        return ResponseEntity.status(status).body(Map.of("error", err));
    }
}
