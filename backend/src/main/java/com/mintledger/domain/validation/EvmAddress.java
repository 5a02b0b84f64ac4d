package com.mintledger.domain.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * EVM address: 0x + 40 hex chars, any case. Null and empty are left to @NotBlank.
 */
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = EvmAddressValidator.class)
public @interface EvmAddress {

    String message() default "Invalid address format";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
