package com.mintledger.api.controller;

import com.mintledger.api.dto.ErrorBody;
import com.mintledger.config.ApiProperties;
import com.mintledger.mint.error.DuplicateMintException;
import com.mintledger.mint.error.InvalidFormatException;
import com.mintledger.mint.error.MintRecordException;
import com.mintledger.mint.error.MintStorageException;
import com.mintledger.mint.error.MintValidationException;
import com.mintledger.mint.error.MissingFieldsException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps mint record failures to HTTP: client errors 400 with the failing fields, duplicates 409,
 * storage failures 500 with the cause echoed only when expose-error-details is on.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class ApiExceptionHandler {

    static final String INTERNAL_ERROR = "INTERNAL_ERROR";
    static final String GENERIC_DETAIL = "Internal server error";

    private final ApiProperties apiProperties;

    @ExceptionHandler(MissingFieldsException.class)
    public ResponseEntity<ErrorBody> handleMissingFields(MissingFieldsException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.withMissing(
                ex.getErrorCode(), "Missing required fields", ex.getMissing(), ex.getRequired()));
    }

    @ExceptionHandler(InvalidFormatException.class)
    public ResponseEntity<ErrorBody> handleInvalidFormat(InvalidFormatException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(MintValidationException.class)
    public ResponseEntity<ErrorBody> handleValidation(MintValidationException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.withViolations(
                ex.getErrorCode(), "Validation failed", ex.getViolations()));
    }

    @ExceptionHandler(DuplicateMintException.class)
    public ResponseEntity<ErrorBody> handleDuplicate(DuplicateMintException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorBody.withDetail(
                ex.getErrorCode(), "Duplicate " + ex.getField(), "This NFT has already been recorded"));
    }

    @ExceptionHandler(MintStorageException.class)
    public ResponseEntity<ErrorBody> handleStorage(MintStorageException ex) {
        log.error("{}: {}", ex.getMessage(), ex.getCause() != null ? ex.getCause().getMessage() : "", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorBody.withDetail(ex.getErrorCode(), ex.getMessage(), detail(ex)));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ErrorBody.INVALID_REQUEST, "Malformed request body"));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorBody> handleStatus(ResponseStatusException ex) {
        return ResponseEntity.status(ex.getStatusCode())
                .body(ErrorBody.of(ErrorBody.codeFor(ex.getStatusCode()), reasonOf(ex)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorBody> handleUnexpected(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorBody.withDetail(INTERNAL_ERROR, "Internal server error", detail(ex)));
    }

    static String reasonOf(ResponseStatusException ex) {
        if (ex.getReason() != null) {
            return ex.getReason();
        }
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        return status != null ? status.getReasonPhrase() : "Request failed";
    }

    private String detail(Exception ex) {
        if (!apiProperties.isExposeErrorDetails()) {
            return GENERIC_DETAIL;
        }
        Throwable cause = ex instanceof MintRecordException && ex.getCause() != null ? ex.getCause() : ex;
        return cause.getMessage();
    }
}
