package com.agentsentry.evaluator.metrics;

import com.agentsentry.evaluator.ErrorKind;
import com.agentsentry.evaluator.classification.Outcome;
import com.agentsentry.evaluator.orchestration.RunContext;
import com.agentsentry.evaluator.orchestration.RunState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.ToDoubleFunction;

/**
 * Exposes evaluation metrics via Micrometer/Prometheus.
 *
 * <p>
 * Registered metrics:
 * </p>
 * <ul>
 * <li>{@code sentry.attempts.dispatched} - Attempts sent to the target</li>
 * <li>{@code sentry.attempts.outcome} - Terminal labels, tagged by outcome</li>
 * <li>{@code sentry.errors} - Attempt-scoped errors, tagged by kind</li>
 * <li>{@code sentry.round.duration} - Wall time of one round</li>
 * <li>{@code sentry.runs} - Finished runs, tagged by final state</li>
 * <li>{@code sentry.knowledge_base.entries}, {@code sentry.archive.size},
 * {@code sentry.bandit.arms} - Gauges over the active run</li>
 * </ul>
 *
 * @author Naveed Gung
 */
@Component
public class SentryMetrics {

    private static final Logger log = LoggerFactory.getLogger(SentryMetrics.class);

    private final MeterRegistry meterRegistry;
    private final AtomicReference<RunContext> activeRun = new AtomicReference<>();

    private final Map<Outcome, Counter> outcomes = new EnumMap<>(Outcome.class);
    private final Map<ErrorKind, Counter> errors = new EnumMap<>(ErrorKind.class);
    private Counter dispatched;
    private Timer roundDuration;

    public SentryMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        dispatched = Counter.builder("sentry.attempts.dispatched")
                .description("Attack attempts dispatched to the target")
                .register(meterRegistry);
        for (Outcome outcome : Outcome.values()) {
            outcomes.put(outcome, Counter.builder("sentry.attempts.outcome")
                    .description("Terminal attempt labels")
                    .tag("outcome", outcome.name())
                    .register(meterRegistry));
        }
        for (ErrorKind kind : ErrorKind.values()) {
            errors.put(kind, Counter.builder("sentry.errors")
                    .description("Attempt-scoped errors by kind")
                    .tag("kind", kind.name())
                    .register(meterRegistry));
        }
        roundDuration = Timer.builder("sentry.round.duration")
                .description("Wall time of one evaluation round")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);

        gauge("sentry.knowledge_base.entries", "Entries in the active run's knowledge base",
                run -> run.getKnowledgeBase().size());
        gauge("sentry.archive.size", "Entries in the active run's novelty archive",
                run -> run.getMutationEngine().getArchive().size());
        gauge("sentry.bandit.arms", "Arms tracked by the active run's allocator",
                run -> run.getAllocator().armCount());

        log.info("Sentry metrics registered");
    }

    public void runStarted(RunContext run) {
        activeRun.set(run);
    }

    public void runFinished(RunContext run, RunState finalState) {
        activeRun.compareAndSet(run, null);
        Counter.builder("sentry.runs")
                .description("Finished evaluation runs by final state")
                .tag("state", finalState.name())
                .register(meterRegistry)
                .increment();
    }

    public void attemptDispatched() {
        dispatched.increment();
    }

    public void outcome(Outcome outcome) {
        outcomes.get(outcome).increment();
    }

    public void error(ErrorKind kind) {
        errors.get(kind).increment();
    }

    public Timer.Sample startRound() {
        return Timer.start(meterRegistry);
    }

    public void stopRound(Timer.Sample sample) {
        sample.stop(roundDuration);
    }

    private void gauge(String name, String description, ToDoubleFunction<RunContext> reading) {
        Gauge.builder(name, activeRun, ref -> {
            RunContext run = ref.get();
            return run == null ? 0.0 : reading.applyAsDouble(run);
        }).description(description).register(meterRegistry);
    }
}
