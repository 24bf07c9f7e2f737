package com.agentsentry.evaluator.target;

/**
 * Coarse inherent risk of a target, derived from its high-impact capabilities.
 *
 * @author Naveed Gung
 */
public enum RiskLevel {
    LOW, MEDIUM, HIGH, CRITICAL;

    /** Risk level for the given number of high-impact capabilities. */
    public static RiskLevel forHighImpactCount(int count) {
        if (count >= 3) {
            return CRITICAL;
        }
        return switch (count) {
            case 2 -> HIGH;
            case 1 -> MEDIUM;
            default -> LOW;
        };
    }
}
