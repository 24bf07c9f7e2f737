package com.agentsentry.evaluator.classification;

/**
 * Change of each detection metric from an earlier to a later evaluation.
 *
 * @author Naveed Gung
 */
public record MetricDeltas(
        double f1Change,
        double precisionChange,
        double recallChange,
        double accuracyChange,
        double falsePositiveRateChange,
        double falseNegativeRateChange) {

    public static MetricDeltas between(EvaluationMetrics earlier, EvaluationMetrics later) {
        return new MetricDeltas(
                later.f1() - earlier.f1(),
                later.precision() - earlier.precision(),
                later.recall() - earlier.recall(),
                later.accuracy() - earlier.accuracy(),
                later.falsePositiveRate() - earlier.falsePositiveRate(),
                later.falseNegativeRate() - earlier.falseNegativeRate());
    }

    /** Stable while the F1 change stays strictly below the threshold. */
    public boolean isStable(double threshold) {
        return Math.abs(f1Change) < threshold;
    }

    public PerformanceTrend trend(double threshold) {
        if (isStable(threshold)) {
            return PerformanceTrend.STABLE;
        }
        return f1Change > 0 ? PerformanceTrend.IMPROVING : PerformanceTrend.DECLINING;
    }
}
