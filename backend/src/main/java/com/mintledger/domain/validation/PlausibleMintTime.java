package com.mintledger.domain.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Mint time must fall between the Ethereum genesis block and one day from now.
 * Null is accepted; pair with {@code @NotNull} when required.
 */
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = PlausibleMintTimeValidator.class)
public @interface PlausibleMintTime {

    String message() default "Mint timestamp is out of range";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
