package com.mintledger.domain.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Event name must be the display name of a {@link com.mintledger.domain.MintEvent}.
 */
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = KnownEventValidator.class)
public @interface KnownEvent {

    String message() default "Unknown event name";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
