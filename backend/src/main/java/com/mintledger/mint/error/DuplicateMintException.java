package com.mintledger.mint.error;

import lombok.Getter;

/**
 * A record with the same identity key already exists.
 */
@Getter
public class DuplicateMintException extends MintRecordException {

    private final String field;
    private final String value;

    public DuplicateMintException(String field, String value, Throwable cause) {
        super(DUPLICATE_KEY, "Duplicate " + field + ": " + value, cause);
        this.field = field;
        this.value = value;
    }
}
