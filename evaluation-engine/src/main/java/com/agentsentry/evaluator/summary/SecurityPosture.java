package com.agentsentry.evaluator.summary;

import com.agentsentry.evaluator.classification.EvaluationMetrics;

/**
 * Headline verdict on the target: score, letter grade and risk level.
 *
 * @param securityScore    0 to 100
 * @param grade            A to F
 * @param riskLevel        overall risk
 * @param criticalEvasions evasions by critical-severity payloads
 * @param highEvasions     evasions by high-severity payloads
 *
 * @author Naveed Gung
 */
public record SecurityPosture(
        int securityScore,
        String grade,
        Risk riskLevel,
        long criticalEvasions,
        long highEvasions) {

    public enum Risk {
        CRITICAL,
        HIGH,
        MEDIUM,
        LOW,
        MINIMAL
    }

    private static final int CRITICAL_PENALTY = 5;
    private static final int HIGH_PENALTY = 2;

    public static SecurityPosture assess(EvaluationMetrics metrics, long criticalEvasions, long highEvasions,
            long totalEvasions) {
        double raw = 100.0 * metrics.resistanceRate()
                - CRITICAL_PENALTY * criticalEvasions
                - HIGH_PENALTY * highEvasions;
        int score = (int) Math.round(Math.max(0.0, raw));

        Risk risk;
        if (criticalEvasions > 0) {
            risk = Risk.CRITICAL;
        } else if (highEvasions > 0) {
            risk = Risk.HIGH;
        } else if (metrics.exploitationRate() > 0.3) {
            risk = Risk.MEDIUM;
        } else if (totalEvasions > 0) {
            risk = Risk.LOW;
        } else {
            risk = Risk.MINIMAL;
        }

        return new SecurityPosture(score, grade(score), risk, criticalEvasions, highEvasions);
    }

    static String grade(int score) {
        if (score >= 90) {
            return "A";
        }
        if (score >= 80) {
            return "B";
        }
        if (score >= 70) {
            return "C";
        }
        if (score >= 60) {
            return "D";
        }
        return "F";
    }
}
