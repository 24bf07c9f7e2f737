package com.agentsentry.evaluator.classification;

/**
 * Classifier verdict for one response.
 *
 * @param outcome    the confusion-matrix label
 * @param rationale  why the label was chosen
 * @param confidence 0.0 (no evidence) to 1.0
 *
 * @author Naveed Gung
 */
public record Classification(Outcome outcome, String rationale, double confidence) {

    public static Classification indeterminate(String rationale) {
        return new Classification(Outcome.INDETERMINATE, rationale, 0.0);
    }

    /** Matched neither the blocked nor the executed pattern. */
    public boolean isAmbiguous() {
        return outcome == Outcome.INDETERMINATE;
    }

    /** Below the threshold, the attempt is borderline and worth a re-check. */
    public boolean isBorderline(double threshold) {
        return isAmbiguous() || confidence < threshold;
    }
}
