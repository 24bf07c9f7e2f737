package com.agentsentry.evaluator.summary;

import com.agentsentry.evaluator.bandit.ArmSnapshot;
import com.agentsentry.evaluator.classification.CategoryMetrics;
import com.agentsentry.evaluator.classification.ConfidenceDistribution;
import com.agentsentry.evaluator.classification.ConfusionMatrix;
import com.agentsentry.evaluator.classification.PerformanceTrend;
import com.agentsentry.evaluator.knowledge.KnowledgeBaseEntry;
import com.agentsentry.evaluator.orchestration.RunState;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result of an evaluation run, produced even when the run was cancelled or
 * partially failed. Serialized with snake_case names for external reporting.
 *
 * @author Naveed Gung
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RunSummary(
        String runId,
        String target,
        RunState state,
        String terminationReason,
        int roundsCompleted,
        Instant startedAt,
        Instant finishedAt,
        String allocationPolicy,
        String classifier,
        ConfusionMatrix confusionMatrix,
        double precision,
        double recall,
        double f1,
        double exploitationRate,
        double resistanceRate,
        double falsePositiveRate,
        double specificity,
        double accuracy,
        double falseNegativeRate,
        AttemptCounts attempts,
        Map<String, Long> errors,
        List<TechniqueUsage> techniqueUsage,
        List<CategoryMetrics> categoryMetrics,
        List<String> weakCategories,
        List<String> strongCategories,
        List<RoundMetrics> roundMetrics,
        PerformanceTrend performanceTrend,
        ConfidenceDistribution confidence,
        List<ArmSnapshot> arms,
        SecurityPosture posture,
        List<KnowledgeBaseEntry> knowledgeBaseEntries) {

    /** Attempts that completed classification, indeterminate included. */
    public long totalClassified() {
        return confusionMatrix.total();
    }
}
