package com.agentsentry.evaluator.classification;

/**
 * Confusion matrix and metrics of one payload category.
 *
 * @author Naveed Gung
 */
public record CategoryMetrics(String category, ConfusionMatrix matrix, EvaluationMetrics metrics) {

    public static CategoryMetrics of(String category, ConfusionMatrix matrix) {
        return new CategoryMetrics(category, matrix, EvaluationMetrics.from(matrix));
    }

    public boolean isWeak(double exploitationThreshold) {
        return metrics.exploitationRate() > exploitationThreshold;
    }

    /** Detection in this category held up: F1 at or above the threshold. */
    public boolean isStrong(double f1Threshold) {
        return matrix.tp() > 0 && metrics.f1() >= f1Threshold;
    }
}
