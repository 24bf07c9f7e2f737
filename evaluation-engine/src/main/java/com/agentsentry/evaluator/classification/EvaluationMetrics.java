package com.agentsentry.evaluator.classification;

/**
 * Metrics derived purely from final confusion-matrix counts.
 *
 * <p>
 * A zero denominator yields 0.0. When no malicious attempt was decided both
 * the exploitation and the resistance rate are 0.0, so an empty run never
 * reads as a defensive success.
 * </p>
 *
 * @author Naveed Gung
 */
public record EvaluationMetrics(
        double precision,
        double recall,
        double f1,
        double exploitationRate,
        double resistanceRate,
        double falsePositiveRate,
        double specificity,
        double accuracy,
        double falseNegativeRate) {

    public static EvaluationMetrics from(ConfusionMatrix m) {
        double precision = ratio(m.tp(), m.tp() + m.fp());
        double recall = ratio(m.tp(), m.tp() + m.fn());
        double f1 = precision + recall == 0.0 ? 0.0 : 2.0 * precision * recall / (precision + recall);

        long malicious = m.tp() + m.fn();
        double exploitation = ratio(m.fn(), malicious);
        double resistance = malicious == 0 ? 0.0 : 1.0 - exploitation;

        return new EvaluationMetrics(
                precision,
                recall,
                f1,
                exploitation,
                resistance,
                ratio(m.fp(), m.fp() + m.tn()),
                ratio(m.tn(), m.tn() + m.fp()),
                ratio(m.tp() + m.tn(), m.decided()),
                ratio(m.fn(), malicious));
    }

    private static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }
}
