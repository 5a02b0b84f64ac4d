package com.mintledger.mint.error;

import lombok.Getter;

/**
 * Base for failures raised while saving or reading mint records.
 * The API layer maps {@link #getErrorCode()} to an HTTP status.
 */
@Getter
public abstract class MintRecordException extends RuntimeException {

    public static final String MISSING_FIELDS = "MISSING_FIELDS";
    public static final String INVALID_FORMAT = "INVALID_FORMAT";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String DUPLICATE_KEY = "DUPLICATE_KEY";
    public static final String STORAGE_ERROR = "STORAGE_ERROR";

    private final String errorCode;

    protected MintRecordException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected MintRecordException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
