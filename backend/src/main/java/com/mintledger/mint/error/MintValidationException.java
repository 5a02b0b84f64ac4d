package com.mintledger.mint.error;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Record failed schema validation. Lists every failing field, not only the first.
 */
@Getter
public class MintValidationException extends MintRecordException {

    private final List<FieldViolation> violations;

    public MintValidationException(List<FieldViolation> violations) {
        super(VALIDATION_ERROR, "Validation failed: " + violations.stream()
                .map(FieldViolation::field)
                .collect(Collectors.joining(", ")));
        this.violations = List.copyOf(violations);
    }
}
