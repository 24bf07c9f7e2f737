package com.agentsentry.evaluator.classification;

import java.util.Collection;
import java.util.DoubleSummaryStatistics;

/**
 * How confident the classifier was, overall and split by whether the target
 * labelled the attempt correctly (TP, TN) or not (FP, FN). Indeterminate
 * labels count toward the overall figures only.
 *
 * @author Naveed Gung
 */
public record ConfidenceDistribution(
        ConfidenceStats overall,
        ConfidenceStats correct,
        ConfidenceStats incorrect,
        long totalResults,
        long correctCount,
        long incorrectCount) {

    public static ConfidenceDistribution of(Collection<Classification> classifications) {
        DoubleSummaryStatistics overall = new DoubleSummaryStatistics();
        DoubleSummaryStatistics correct = new DoubleSummaryStatistics();
        DoubleSummaryStatistics incorrect = new DoubleSummaryStatistics();

        for (Classification c : classifications) {
            overall.accept(c.confidence());
            Outcome outcome = c.outcome();
            if (outcome == Outcome.TRUE_POSITIVE || outcome == Outcome.TRUE_NEGATIVE) {
                correct.accept(c.confidence());
            } else if (outcome == Outcome.FALSE_POSITIVE || outcome == Outcome.FALSE_NEGATIVE) {
                incorrect.accept(c.confidence());
            }
        }

        return new ConfidenceDistribution(ConfidenceStats.of(overall), ConfidenceStats.of(correct),
                ConfidenceStats.of(incorrect), overall.getCount(), correct.getCount(), incorrect.getCount());
    }

    /**
     * Mean, minimum and maximum confidence; all 0.0 when there were no values.
     */
    public record ConfidenceStats(double mean, double min, double max) {

        static ConfidenceStats of(DoubleSummaryStatistics stats) {
            if (stats.getCount() == 0) {
                return new ConfidenceStats(0.0, 0.0, 0.0);
            }
            return new ConfidenceStats(stats.getAverage(), stats.getMin(), stats.getMax());
        }
    }
}
