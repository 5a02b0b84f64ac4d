package com.mintledger.mint.error;

/**
 * One failed field constraint. Field is the document path, e.g. eventData.mintedAt.
 */
public record FieldViolation(String field, String message) {
}
