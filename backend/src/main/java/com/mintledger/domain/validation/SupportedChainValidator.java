package com.mintledger.domain.validation;

import com.mintledger.domain.ChainNetwork;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class SupportedChainValidator implements ConstraintValidator<SupportedChain, Integer> {

    @Override
    public boolean isValid(Integer value, ConstraintValidatorContext context) {
        return value == null || ChainNetwork.fromChainId(value).isPresent();
    }
}
