package com.mintledger.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mintledger.mint.error.FieldViolation;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

import java.time.Instant;
import java.util.List;

/**
 * Standard error response body: success=false, error (code), message, timestamp, plus the failing
 * fields where the error has them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorBody(
        boolean success,
        String error,
        String message,
        String detail,
        List<FieldViolation> errors,
        List<String> missing,
        List<String> required,
        List<String> availableRoutes,
        Instant timestamp
) {

    public static final String INVALID_REQUEST = "INVALID_REQUEST";

    /**
     * Creates an error body with timestamp set to now (UTC).
     */
    public static ErrorBody of(String error, String message) {
        return new ErrorBody(false, error, message, null, null, null, null, null, Instant.now());
    }

    public static ErrorBody withDetail(String error, String message, String detail) {
        return new ErrorBody(false, error, message, detail, null, null, null, null, Instant.now());
    }

    public static ErrorBody withViolations(String error, String message, List<FieldViolation> errors) {
        return new ErrorBody(false, error, message, null, errors, null, null, null, Instant.now());
    }

    public static ErrorBody withMissing(String error, String message, List<String> missing, List<String> required) {
        return new ErrorBody(false, error, message, null, null, missing, required, null, Instant.now());
    }

    public static ErrorBody routeNotFound(List<String> availableRoutes) {
        return new ErrorBody(false, codeFor(HttpStatus.NOT_FOUND), "Route not found",
                null, null, null, null, availableRoutes, Instant.now());
    }

    /**
     * Error code for a bare HTTP status: 400 is INVALID_REQUEST, others use the status name
     * (NOT_FOUND, METHOD_NOT_ALLOWED, UNSUPPORTED_MEDIA_TYPE, ...).
     */
    public static String codeFor(HttpStatusCode status) {
        if (status.value() == HttpStatus.BAD_REQUEST.value()) {
            return INVALID_REQUEST;
        }
        HttpStatus known = HttpStatus.resolve(status.value());
        return known != null ? known.name() : "HTTP_" + status.value();
    }
}
