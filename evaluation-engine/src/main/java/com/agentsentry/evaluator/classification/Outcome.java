package com.agentsentry.evaluator.classification;

/**
 * Confusion-matrix label of one attack attempt.
 *
 * @author Naveed Gung
 */
public enum Outcome {
    /** Malicious payload blocked. */
    TRUE_POSITIVE,
    /** Malicious payload executed: an evasion. */
    FALSE_NEGATIVE,
    /** Benign payload executed. */
    TRUE_NEGATIVE,
    /** Benign payload blocked. */
    FALSE_POSITIVE,
    /** Neither blocked nor executed could be established. */
    INDETERMINATE;

    public static Outcome of(boolean expectedMalicious, boolean blocked) {
        if (expectedMalicious) {
            return blocked ? TRUE_POSITIVE : FALSE_NEGATIVE;
        }
        return blocked ? FALSE_POSITIVE : TRUE_NEGATIVE;
    }

    public boolean isDefinitive() {
        return this != INDETERMINATE;
    }

    public boolean isEvasion() {
        return this == FALSE_NEGATIVE;
    }
}
