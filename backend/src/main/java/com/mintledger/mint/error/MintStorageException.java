package com.mintledger.mint.error;

/**
 * Underlying store unavailable or failed unexpectedly. Message is the operation-level summary;
 * the driver error is kept as cause.
 */
public class MintStorageException extends MintRecordException {

    public MintStorageException(String message, Throwable cause) {
        super(STORAGE_ERROR, message, cause);
    }
}
