package com.flagship.fraud_decisions.validation.constraint;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Decision and decision reason must fit the evaluation stage.
 *
 * AUTH requires both. MONITORING may carry neither or both, never only one. Violations are
 * reported on the {@code decision} or {@code decision_reason} property.
 */
@Documented
@Constraint(validatedBy = DecisionMatchesStageValidator.class)
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface DecisionMatchesStage {

    String message() default "decision does not fit evaluation_type";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
