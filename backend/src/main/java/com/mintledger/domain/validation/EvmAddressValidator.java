package com.mintledger.domain.validation;

import com.mintledger.common.HexIdentifiers;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Delegates to HexIdentifiers for a single source of truth.
 */
public class EvmAddressValidator implements ConstraintValidator<EvmAddress, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || value.isEmpty() || HexIdentifiers.isAddress(value);
    }
}
