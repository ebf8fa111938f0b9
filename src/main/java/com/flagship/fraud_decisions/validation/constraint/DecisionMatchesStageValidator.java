package com.flagship.fraud_decisions.validation.constraint;

import com.flagship.fraud_decisions.event.EvaluationType;
import com.flagship.fraud_decisions.validation.dto.DecisionEventPayload;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class DecisionMatchesStageValidator implements ConstraintValidator<DecisionMatchesStage, DecisionEventPayload> {

    @Override
    public boolean isValid(DecisionEventPayload event, ConstraintValidatorContext context) {
        // a missing stage is reported by its own @NotNull
        if (event == null || event.getEvaluationType() == null) {
            return true;
        }
        EvaluationType type = event.getEvaluationType();
        boolean hasDecision = event.getDecision() != null;
        boolean hasReason = event.getDecisionReason() != null;

        if (type.requiresDecision()) {
            if (!hasDecision) {
                return reject(context, "decision", "required for evaluation_type " + type);
            }
            if (!hasReason) {
                return reject(context, "decisionReason", "required for evaluation_type " + type);
            }
        } else if (hasDecision != hasReason) {
            return reject(context, hasDecision ? "decisionReason" : "decision",
                    "decision and decision_reason must be given together");
        }
        return true;
    }

    private static boolean reject(ConstraintValidatorContext context, String property, String message) {
        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(message)
                .addPropertyNode(property)
                .addConstraintViolation();
        return false;
    }
}
