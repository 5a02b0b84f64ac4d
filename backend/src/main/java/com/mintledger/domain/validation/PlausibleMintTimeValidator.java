package com.mintledger.domain.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.time.Duration;
import java.time.Instant;

public class PlausibleMintTimeValidator implements ConstraintValidator<PlausibleMintTime, Instant> {

    static final Instant EARLIEST = Instant.parse("2015-07-30T00:00:00Z");
    static final Duration CLOCK_SKEW = Duration.ofDays(1);

    @Override
    public boolean isValid(Instant value, ConstraintValidatorContext context) {
        if (value == null) return true;
        return !value.isBefore(EARLIEST) && !value.isAfter(Instant.now().plus(CLOCK_SKEW));
    }
}
