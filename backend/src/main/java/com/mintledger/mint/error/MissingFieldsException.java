package com.mintledger.mint.error;

import lombok.Getter;

import java.util.List;

/**
 * Required payload fields absent or blank. Carries exactly the absent ones plus the full required list.
 */
@Getter
public class MissingFieldsException extends MintRecordException {

    private final List<String> missing;
    private final List<String> required;

    public MissingFieldsException(List<String> missing, List<String> required) {
        super(MISSING_FIELDS, "Missing required fields: " + String.join(", ", missing));
        this.missing = List.copyOf(missing);
        this.required = List.copyOf(required);
    }
}
