package com.mintledger.domain.validation;

import com.mintledger.domain.MintEvent;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class KnownEventValidator implements ConstraintValidator<KnownEvent, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || value.isEmpty() || MintEvent.isKnown(value);
    }
}
