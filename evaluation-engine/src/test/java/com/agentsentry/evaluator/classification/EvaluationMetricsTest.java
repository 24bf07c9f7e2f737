package com.agentsentry.evaluator.classification;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationMetricsTest {

    @Test
    void shouldComputeRatesFromMatrix() {
        EvaluationMetrics m = EvaluationMetrics.from(new ConfusionMatrix(24, 2, 1, 26, 0));

        assertEquals(0.52, m.exploitationRate(), 1e-9);
        assertEquals(0.48, m.resistanceRate(), 1e-9);
        assertEquals(2.0 / 3.0, m.falsePositiveRate(), 1e-9);
        assertEquals(0.48, m.recall(), 1e-9);
        assertEquals(24.0 / 26.0, m.precision(), 1e-9);
        assertEquals(1.0 / 3.0, m.specificity(), 1e-9);
        assertEquals(25.0 / 53.0, m.accuracy(), 1e-9);
        assertEquals(0.52, m.falseNegativeRate(), 1e-9);
        assertEquals(2 * m.precision() * m.recall() / (m.precision() + m.recall()), m.f1(), 1e-9);
    }

    @Test
    void shouldReportZeroF1WithoutTruePositives() {
        EvaluationMetrics m = EvaluationMetrics.from(new ConfusionMatrix(0, 3, 2, 5, 1));

        assertEquals(0.0, m.precision(), 1e-9);
        assertEquals(0.0, m.recall(), 1e-9);
        assertEquals(0.0, m.f1(), 1e-9);
        assertEquals(1.0, m.exploitationRate(), 1e-9);
    }

    @Test
    void shouldReportZeroRatesForEmptyMatrix() {
        EvaluationMetrics m = EvaluationMetrics.from(ConfusionMatrix.EMPTY);

        assertEquals(0.0, m.exploitationRate(), 1e-9);
        assertEquals(0.0, m.resistanceRate(), 1e-9);
        assertEquals(0.0, m.falsePositiveRate(), 1e-9);
        assertEquals(0.0, m.accuracy(), 1e-9);
    }

    @Test
    void shouldKeepIndeterminateOutOfRates() {
        EvaluationMetrics withIndeterminate = EvaluationMetrics.from(new ConfusionMatrix(4, 0, 0, 4, 20));

        assertEquals(0.5, withIndeterminate.exploitationRate(), 1e-9);
        assertEquals(0.5, withIndeterminate.accuracy(), 1e-9);
    }

    @Test
    void shouldCountOutcomes() {
        List<Outcome> outcomes = new ArrayList<>();
        outcomes.addAll(Collections.nCopies(3, Outcome.TRUE_POSITIVE));
        outcomes.addAll(Collections.nCopies(2, Outcome.FALSE_NEGATIVE));
        outcomes.add(Outcome.TRUE_NEGATIVE);
        outcomes.add(Outcome.INDETERMINATE);

        ConfusionMatrix matrix = ConfusionMatrix.of(outcomes);

        assertEquals(new ConfusionMatrix(3, 0, 1, 2, 1), matrix);
        assertEquals(7, matrix.total());
        assertEquals(6, matrix.decided());
        assertEquals(new ConfusionMatrix(3, 1, 1, 2, 1), matrix.with(Outcome.FALSE_POSITIVE));
    }

    @Test
    void shouldFlagWeakCategory() {
        CategoryMetrics weak = CategoryMetrics.of("execution", new ConfusionMatrix(1, 0, 0, 3, 0));
        CategoryMetrics strong = CategoryMetrics.of("impact", new ConfusionMatrix(9, 0, 0, 1, 0));

        assertTrue(weak.isWeak(0.5));
        assertFalse(strong.isWeak(0.5));
    }

    @Test
    void shouldFlagStrongCategoryByF1() {
        CategoryMetrics weak = CategoryMetrics.of("execution", new ConfusionMatrix(1, 0, 0, 3, 0));
        CategoryMetrics strong = CategoryMetrics.of("impact", new ConfusionMatrix(9, 0, 0, 1, 0));
        CategoryMetrics controls = CategoryMetrics.of("benign-control", new ConfusionMatrix(0, 0, 5, 0, 0));

        assertTrue(strong.isStrong(0.6));
        assertFalse(weak.isStrong(0.6));
        assertFalse(controls.isStrong(0.0));
    }

    @Test
    void shouldDeriveTrendFromF1Change() {
        EvaluationMetrics empty = EvaluationMetrics.from(ConfusionMatrix.EMPTY);
        EvaluationMetrics good = EvaluationMetrics.from(new ConfusionMatrix(9, 0, 0, 1, 0));

        MetricDeltas up = MetricDeltas.between(empty, good);
        MetricDeltas down = MetricDeltas.between(good, empty);

        assertEquals(good.f1(), up.f1Change(), 1e-9);
        assertEquals(0.1, up.falseNegativeRateChange(), 1e-9);
        assertEquals(PerformanceTrend.IMPROVING, up.trend(0.05));
        assertEquals(PerformanceTrend.DECLINING, down.trend(0.05));
        assertEquals(PerformanceTrend.STABLE, MetricDeltas.between(good, good).trend(0.05));
        assertTrue(up.isStable(1.0));
    }

    @Test
    void shouldSummarizeConfidenceByCorrectness() {
        ConfidenceDistribution distribution = ConfidenceDistribution.of(List.of(
                new Classification(Outcome.TRUE_POSITIVE, "blocked", 0.9),
                new Classification(Outcome.TRUE_NEGATIVE, "executed", 0.7),
                new Classification(Outcome.FALSE_NEGATIVE, "executed", 0.95),
                new Classification(Outcome.FALSE_POSITIVE, "blocked", 0.4),
                Classification.indeterminate("no indicator")));

        assertEquals(5, distribution.totalResults());
        assertEquals(0.59, distribution.overall().mean(), 1e-9);
        assertEquals(0.0, distribution.overall().min(), 1e-9);
        assertEquals(2, distribution.correctCount());
        assertEquals(0.8, distribution.correct().mean(), 1e-9);
        assertEquals(0.7, distribution.correct().min(), 1e-9);
        assertEquals(2, distribution.incorrectCount());
        assertEquals(0.675, distribution.incorrect().mean(), 1e-9);
        assertEquals(0.95, distribution.incorrect().max(), 1e-9);
    }

    @Test
    void shouldReportZeroConfidenceWithoutResults() {
        ConfidenceDistribution distribution = ConfidenceDistribution.of(List.of());

        assertEquals(0, distribution.totalResults());
        assertEquals(new ConfidenceDistribution.ConfidenceStats(0.0, 0.0, 0.0), distribution.correct());
    }
}
