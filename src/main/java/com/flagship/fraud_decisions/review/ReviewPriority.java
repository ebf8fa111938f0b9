package com.flagship.fraud_decisions.review;

import com.flagship.fraud_decisions.event.Decision;
import com.flagship.fraud_decisions.event.RiskLevel;

/**
 * Default priority of a new review, 1 being the most urgent.
 */
public final class ReviewPriority {

    public static final int HIGHEST = 1;
    public static final int LOWEST = 4;
    static final int DEFAULT = 3;
    static final int DECLINED = 2;

    private ReviewPriority() {
    }

    /**
     * Priority follows the risk level; a declined transaction is raised to at least {@value #DECLINED}.
     */
    public static int forEvent(RiskLevel riskLevel, Decision decision) {
        int priority = fromRiskLevel(riskLevel);
        if (decision == Decision.DECLINE) {
            priority = Math.min(priority, DECLINED);
        }
        return priority;
    }

    static int fromRiskLevel(RiskLevel riskLevel) {
        if (riskLevel == null) {
            return DEFAULT;
        }
        return switch (riskLevel) {
            case CRITICAL -> 1;
            case HIGH -> 2;
            case MEDIUM -> 3;
            case LOW -> 4;
        };
    }
}
