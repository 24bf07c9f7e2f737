package com.agentsentry.evaluator.summary;

import com.agentsentry.evaluator.ErrorKind;
import com.agentsentry.evaluator.classification.CategoryMetrics;
import com.agentsentry.evaluator.classification.ConfidenceDistribution;
import com.agentsentry.evaluator.classification.ConfusionMatrix;
import com.agentsentry.evaluator.classification.EvaluationMetrics;
import com.agentsentry.evaluator.classification.MetricDeltas;
import com.agentsentry.evaluator.classification.Outcome;
import com.agentsentry.evaluator.classification.PerformanceTrend;
import com.agentsentry.evaluator.config.EvaluationProperties;
import com.agentsentry.evaluator.orchestration.AttemptLedger;
import com.agentsentry.evaluator.orchestration.ResolvedAttempt;
import com.agentsentry.evaluator.orchestration.RunContext;
import com.agentsentry.evaluator.payload.Payload;
import com.agentsentry.evaluator.payload.Severity;
import com.agentsentry.evaluator.scoring.ScoredTechnique;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Builds the {@link RunSummary} from the state containers of a finished run.
 * All metrics derive from the final ledger.
 *
 * @author Naveed Gung
 */
@Component
public class RunSummaryAssembler {

    private final EvaluationProperties properties;

    public RunSummaryAssembler(EvaluationProperties properties) {
        this.properties = properties;
    }

    public RunSummary assemble(RunContext run, String classifierName) {
        AttemptLedger ledger = run.getLedger();
        List<ResolvedAttempt> records = ledger.resolved();
        ConfusionMatrix matrix = ledger.matrix();
        EvaluationMetrics metrics = EvaluationMetrics.from(matrix);

        List<CategoryMetrics> categories = categoryMetrics(records);
        List<String> weak = categories.stream()
                .filter(c -> !Payload.CONTROL_CATEGORY.equals(c.category()))
                .filter(c -> c.isWeak(properties.getWeakCategoryThreshold()))
                .map(CategoryMetrics::category)
                .toList();
        List<String> strong = categories.stream()
                .filter(c -> !Payload.CONTROL_CATEGORY.equals(c.category()))
                .filter(c -> c.isStrong(properties.getStrongCategoryThreshold()))
                .filter(c -> !weak.contains(c.category()))
                .map(CategoryMetrics::category)
                .toList();
        List<RoundMetrics> rounds = roundMetrics(records, properties.getStabilityThreshold());

        List<ResolvedAttempt> evasions = records.stream().filter(r -> r.outcome().isEvasion()).toList();
        long critical = evasions.stream().filter(r -> r.attempt().payload().severity() == Severity.CRITICAL).count();
        long high = evasions.stream().filter(r -> r.attempt().payload().severity() == Severity.HIGH).count();

        Map<String, Long> errors = run.getErrors().snapshot();
        errors.merge(ErrorKind.ALLOCATION.name().toLowerCase(Locale.ROOT),
                (long) run.getAllocator().getFallbacks(), Long::sum);

        return new RunSummary(
                run.getRunId(),
                run.getTarget() == null ? null : run.getTarget().name(),
                run.getStateMachine().current(),
                run.getControl().stopReason(),
                run.getRoundsCompleted(),
                run.getStartedAt(),
                run.getFinishedAt(),
                run.getAllocator().policyName(),
                classifierName,
                matrix,
                metrics.precision(),
                metrics.recall(),
                metrics.f1(),
                metrics.exploitationRate(),
                metrics.resistanceRate(),
                metrics.falsePositiveRate(),
                metrics.specificity(),
                metrics.accuracy(),
                metrics.falseNegativeRate(),
                new AttemptCounts(matrix.decided(), matrix.indeterminate(), ledger.getAbandoned()),
                errors,
                techniqueUsage(run.getActiveTechniques(), records),
                categories,
                weak,
                strong,
                rounds,
                rounds.isEmpty() ? PerformanceTrend.STABLE : rounds.get(rounds.size() - 1).trend(),
                ConfidenceDistribution.of(records.stream().map(ResolvedAttempt::classification).toList()),
                run.getAllocator().snapshots(),
                SecurityPosture.assess(metrics, critical, high, evasions.size()),
                run.getKnowledgeBase().snapshot());
    }

    static List<CategoryMetrics> categoryMetrics(List<ResolvedAttempt> records) {
        Map<String, List<Outcome>> byCategory = records.stream().collect(Collectors.groupingBy(
                r -> r.attempt().payload().category(), TreeMap::new,
                Collectors.mapping(ResolvedAttempt::outcome, Collectors.toList())));

        List<CategoryMetrics> metrics = new ArrayList<>();
        byCategory.forEach((category, outcomes) -> metrics.add(CategoryMetrics.of(category, ConfusionMatrix.of(outcomes))));
        return metrics;
    }

    static List<RoundMetrics> roundMetrics(List<ResolvedAttempt> records, double stabilityThreshold) {
        Map<Integer, List<Outcome>> byRound = records.stream().collect(Collectors.groupingBy(
                r -> r.attempt().round(), TreeMap::new,
                Collectors.mapping(ResolvedAttempt::outcome, Collectors.toList())));

        List<RoundMetrics> rounds = new ArrayList<>();
        EvaluationMetrics previous = null;
        for (Map.Entry<Integer, List<Outcome>> entry : byRound.entrySet()) {
            ConfusionMatrix matrix = ConfusionMatrix.of(entry.getValue());
            EvaluationMetrics current = EvaluationMetrics.from(matrix);
            MetricDeltas changes = previous == null ? null : MetricDeltas.between(previous, current);
            PerformanceTrend trend = changes == null ? PerformanceTrend.STABLE : changes.trend(stabilityThreshold);
            rounds.add(new RoundMetrics(entry.getKey(), matrix, current, changes, trend));
            previous = current;
        }
        return rounds;
    }

    static List<TechniqueUsage> techniqueUsage(List<ScoredTechnique> techniques, List<ResolvedAttempt> records) {
        Map<String, List<ResolvedAttempt>> byTechnique = records.stream()
                .collect(Collectors.groupingBy(r -> r.attempt().payload().techniqueId()));

        List<TechniqueUsage> usage = new ArrayList<>();
        for (ScoredTechnique scored : techniques) {
            List<ResolvedAttempt> attempts = byTechnique.getOrDefault(scored.id(), List.of());
            usage.add(new TechniqueUsage(
                    scored.id(),
                    scored.technique().name(),
                    scored.category(),
                    scored.rank(),
                    scored.score(),
                    attempts.size(),
                    attempts.stream().filter(r -> r.attempt().payload().isControl()).count(),
                    attempts.stream().filter(r -> r.outcome() == Outcome.FALSE_NEGATIVE).count(),
                    attempts.stream().filter(r -> r.outcome() == Outcome.TRUE_POSITIVE
                            || r.outcome() == Outcome.FALSE_POSITIVE).count(),
                    attempts.stream().filter(r -> r.outcome() == Outcome.INDETERMINATE).count(),
                    attempts.stream().filter(r -> r.attempt().payload().isMutated()).count()));
        }
        return usage;
    }
}
