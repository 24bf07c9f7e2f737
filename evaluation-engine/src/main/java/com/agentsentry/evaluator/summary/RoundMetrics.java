package com.agentsentry.evaluator.summary;

import com.agentsentry.evaluator.classification.ConfusionMatrix;
import com.agentsentry.evaluator.classification.EvaluationMetrics;
import com.agentsentry.evaluator.classification.MetricDeltas;
import com.agentsentry.evaluator.classification.PerformanceTrend;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Detection metrics of the attempts issued in one round, compared with the
 * previous round.
 *
 * @param round           round number, starting at 1
 * @param confusionMatrix labels of the round's attempts
 * @param metrics         metrics derived from that matrix
 * @param changes         change from the previous round; null for the first
 * @param trend           F1 direction against the previous round
 *
 * @author Naveed Gung
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RoundMetrics(
        int round,
        ConfusionMatrix confusionMatrix,
        EvaluationMetrics metrics,
        MetricDeltas changes,
        PerformanceTrend trend) {
}
