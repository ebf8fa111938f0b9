package com.flagship.fraud_decisions.validation.constraint;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * An ISO-8601 date-time with exactly millisecond precision and an explicit offset,
 * e.g. {@code 2026-01-15T10:00:00.000Z} or {@code 2026-01-15T12:00:00.000+02:00}.
 * Null is valid.
 */
@Documented
@Constraint(validatedBy = MillisTimestampValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface MillisTimestamp {

    String message() default "must be an ISO-8601 timestamp with millisecond precision and explicit offset";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
