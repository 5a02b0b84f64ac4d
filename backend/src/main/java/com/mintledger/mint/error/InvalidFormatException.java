package com.mintledger.mint.error;

import lombok.Getter;

/**
 * Identifier did not match its format (address, hash, CID).
 */
@Getter
public class InvalidFormatException extends MintRecordException {

    private final String field;

    public InvalidFormatException(String field, String message) {
        super(INVALID_FORMAT, message);
        this.field = field;
    }
}
