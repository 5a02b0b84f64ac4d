package com.mintledger.domain.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Chain id must be one of {@link com.mintledger.domain.ChainNetwork}.
 */
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = SupportedChainValidator.class)
public @interface SupportedChain {

    String message() default "Unsupported network chain id";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
