package com.agentsentry.evaluator.orchestration;

import com.agentsentry.evaluator.ErrorKind;
import com.agentsentry.evaluator.bandit.AllocationException;
import com.agentsentry.evaluator.bandit.ArmGranularity;
import com.agentsentry.evaluator.bandit.BanditAllocator;
import com.agentsentry.evaluator.catalog.TechniqueCatalog;
import com.agentsentry.evaluator.classification.Classification;
import com.agentsentry.evaluator.classification.Outcome;
import com.agentsentry.evaluator.classification.OutcomeClassifier;
import com.agentsentry.evaluator.config.EvaluationProperties;
import com.agentsentry.evaluator.generation.TextGenerationClient;
import com.agentsentry.evaluator.knowledge.InsightType;
import com.agentsentry.evaluator.knowledge.KnowledgeBase;
import com.agentsentry.evaluator.metrics.SentryMetrics;
import com.agentsentry.evaluator.mutation.MutationEngine;
import com.agentsentry.evaluator.payload.GenerationException;
import com.agentsentry.evaluator.payload.Payload;
import com.agentsentry.evaluator.payload.PayloadGenerator;
import com.agentsentry.evaluator.payload.PayloadTemplates;
import com.agentsentry.evaluator.scoring.RelevanceScorer;
import com.agentsentry.evaluator.scoring.ScoredTechnique;
import com.agentsentry.evaluator.scoring.ScoringException;
import com.agentsentry.evaluator.summary.RunSummary;
import com.agentsentry.evaluator.summary.RunSummaryAssembler;
import com.agentsentry.evaluator.target.AgentResponse;
import com.agentsentry.evaluator.target.DiscoveryDocument;
import com.agentsentry.evaluator.target.TargetClient;
import com.agentsentry.evaluator.target.TargetProfile;
import com.agentsentry.evaluator.target.TargetProfileFactory;
import com.agentsentry.evaluator.target.TargetUnreachableException;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Runs evaluation rounds and owns the run lifecycle.
 *
 * <p>
 * Each round runs four roles in order, each as a pool of concurrent workers
 * sharing the run's state containers:
 * </p>
 * <ol>
 * <li><b>probing</b>: proposes candidates, from the payload generator in the
 * first round and from a mix of generator and mutation engine afterwards,
 * recommended techniques first</li>
 * <li><b>exploiting</b>: asks the allocator for an arm, dispatches one of its
 * payloads, classifies the response and feeds confident labels back
 * immediately</li>
 * <li><b>validating</b>: re-dispatches borderline attempts; a definitive,
 * more confident re-check replaces the label</li>
 * <li><b>counterfactual</b>: dispatches a benign near-duplicate of malicious
 * attempts and records what the comparison says about the label</li>
 * </ol>
 *
 * <p>
 * Rounds run sequentially. The run stops after the configured round count or
 * at the deadline or cancellation, whichever comes first. In-flight attempts
 * get a grace period, then are abandoned; a summary is produced either way.
 * Only a {@link ScoringException} escapes.
 * </p>
 *
 * @author Naveed Gung
 */
@Service
public class EvaluationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(EvaluationOrchestrator.class);

    static final String PROBER_ID = "prober";
    static final String STRATEGIST_ID = "strategist";

    private static final long STOP_POLL_MS = 50L;

    private final TechniqueCatalog catalog;
    private final RelevanceScorer scorer;
    private final PayloadTemplates templates;
    private final TextGenerationClient textGeneration;
    private final OutcomeClassifier classifier;
    private final TargetClient targetClient;
    private final TargetProfileFactory profileFactory;
    private final EvaluationProperties properties;
    private final SentryMetrics metrics;
    private final RunSummaryAssembler assembler;

    private final AtomicLong runSequence = new AtomicLong();

    public EvaluationOrchestrator(
            TechniqueCatalog catalog,
            RelevanceScorer scorer,
            PayloadTemplates templates,
            TextGenerationClient textGeneration,
            OutcomeClassifier classifier,
            TargetClient targetClient,
            TargetProfileFactory profileFactory,
            EvaluationProperties properties,
            SentryMetrics metrics,
            RunSummaryAssembler assembler) {
        this.catalog = catalog;
        this.scorer = scorer;
        this.templates = templates;
        this.textGeneration = textGeneration;
        this.classifier = classifier;
        this.targetClient = targetClient;
        this.profileFactory = profileFactory;
        this.properties = properties;
        this.metrics = metrics;
        this.assembler = assembler;
    }

    /**
     * Discover the configured target and evaluate it.
     *
     * @throws ScoringException if discovery fails or yields an incomplete
     *                          profile
     */
    public RunSummary evaluate(RunControl control) {
        DiscoveryDocument document;
        try {
            document = targetClient.discover();
        } catch (TargetUnreachableException e) {
            metrics.error(ErrorKind.SCORING);
            throw new ScoringException("Target discovery failed: " + e.getMessage(), e);
        }
        return evaluate(profileFactory.fromDiscovery(document), control);
    }

    /**
     * Evaluate a target profile.
     *
     * @param target  the profile to score techniques against
     * @param control deadline and cancellation signal
     * @return the run summary, possibly partial
     * @throws ScoringException if the profile is incomplete; no attempt is
     *                          issued in that case
     */
    public RunSummary evaluate(TargetProfile target, RunControl control) {
        String runId = String.format("AS-%d-%04d", System.currentTimeMillis(), runSequence.incrementAndGet());
        long seed = properties.getSeed();
        RunContext run = new RunContext(runId, target, control,
                BanditAllocator.of(properties.getAllocationPolicy(), seed),
                new MutationEngine(properties.getMutation(), seed),
                new PayloadGenerator(templates, textGeneration, target == null ? null : target.name()));
        RunStateMachine states = run.getStateMachine();
        metrics.runStarted(run);

        log.info("Run {} started (rounds={}, attempts/round={}, deadline={}, policy={})",
                runId, properties.getMaxRounds(), properties.getAttemptsPerRound(),
                control.getDeadline(), run.getAllocator().policyName());

        boolean stopped = control.shouldStop();
        if (!stopped) {
            states.transition(RunState.PROFILING);
            profile(run);
            registerArms(run);
        }

        for (int round = 1; !stopped && round <= properties.getMaxRounds(); round++) {
            states.transition(RunState.ROUND_ACTIVE);
            Timer.Sample sample = metrics.startRound();
            try {
                runRound(run, round);
            } finally {
                metrics.stopRound(sample);
            }

            if (control.shouldStop()) {
                stopped = true;
            } else {
                run.completeRound();
            }
        }

        return finish(run, stopped);
    }

    private void profile(RunContext run) {
        try {
            List<ScoredTechnique> active = scorer.topK(run.getTarget(), catalog.all(), properties.getTopK());
            run.setActiveTechniques(active);
            log.info("Run {}: {} active techniques selected from {}", run.getRunId(), active.size(), catalog.size());
        } catch (ScoringException e) {
            metrics.error(ErrorKind.SCORING);
            run.getStateMachine().transition(RunState.ABORTED);
            run.markFinished();
            metrics.runFinished(run, RunState.ABORTED);
            log.error("Run {} aborted before any attempt: {}", run.getRunId(), e.getMessage());
            throw e;
        }
    }

    private void registerArms(RunContext run) {
        Set<String> keys = new LinkedHashSet<>();
        for (ScoredTechnique scored : run.getActiveTechniques()) {
            keys.add(properties.getArmGranularity() == ArmGranularity.TECHNIQUE ? scored.id() : scored.category());
        }
        if (PayloadGenerator.controlStride(properties.getMaliciousRatio()) > 0) {
            keys.add(Payload.CONTROL_CATEGORY);
        }
        run.getAllocator().register(keys);
    }

    private RunSummary finish(RunContext run, boolean stopped) {
        RunStateMachine states = run.getStateMachine();
        int abandoned;
        if (stopped) {
            states.transition(RunState.TERMINATING_EARLY);
            abandoned = run.getLedger().seal();
            states.transition(RunState.TERMINATED_EARLY);
        } else {
            states.transition(RunState.FINALIZING);
            abandoned = run.getLedger().seal();
            states.transition(RunState.DONE);
        }
        run.markFinished();

        run.getLedger().resolved().forEach(record -> metrics.outcome(record.outcome()));
        RunSummary summary = assembler.assemble(run, classifier.name());
        metrics.runFinished(run, states.current());

        log.info("Run {} {}: rounds={} matrix={} abandoned={} exploitation={} resistance={} trend={} grade={}",
                run.getRunId(), states.current(), summary.roundsCompleted(), summary.confusionMatrix(),
                abandoned, String.format("%.3f", summary.exploitationRate()),
                String.format("%.3f", summary.resistanceRate()), summary.performanceTrend(),
                summary.posture().grade());
        return summary;
    }

    // -- Round ---------------------------------------------------------------

    private void runRound(RunContext run, int round) {
        CandidatePool pool = new CandidatePool(properties.getArmGranularity());
        pool.addAll(probe(run, round));
        run.getAllocator().register(pool.pendingKeys());
        log.info("Run {} round {}: {} candidates across arms {}", run.getRunId(), round, pool.size(),
                pool.pendingKeys());

        List<ResolvedAttempt> borderline = exploit(run, round, pool);

        if (run.getControl().shouldStop()) {
            return;
        }
        validate(run, round, borderline);

        if (run.getControl().shouldStop()) {
            return;
        }
        counterfactual(run, round);
        recommend(run, round);
    }

    // -- Probing role --------------------------------------------------------

    List<Payload> probe(RunContext run, int round) {
        List<Payload> candidates = new ArrayList<>();
        int budget = properties.getAttemptsPerRound();

        if (round > 1) {
            int mutants = (int) Math.round(budget * properties.getMutationMix());
            candidates.addAll(run.getMutationEngine().propose(mutants));
        }

        for (ScoredTechnique scored : probingOrder(run)) {
            if (round > 1 && candidates.size() >= budget) {
                break;
            }
            if (run.getUnproducible().contains(scored.id())) {
                continue;
            }
            try {
                candidates.addAll(run.getGenerator().generate(scored, properties.getPayloadsPerTechnique(),
                        properties.getMaliciousRatio()));
            } catch (GenerationException e) {
                run.getUnproducible().add(e.getTechniqueId());
                recordError(run, ErrorKind.GENERATION);
                log.warn("Skipping technique {}: {}", e.getTechniqueId(), e.getMessage());
            }
        }

        long mutated = candidates.stream().filter(Payload::isMutated).count();
        log.debug("Round {} probing: {} generated, {} mutated", round, candidates.size() - mutated, mutated);
        return candidates;
    }

    /** Recommended techniques first, in recommendation order, then by rank. */
    private List<ScoredTechnique> probingOrder(RunContext run) {
        Map<String, ScoredTechnique> byId = new LinkedHashMap<>();
        run.getActiveTechniques().forEach(t -> byId.put(t.id(), t));

        List<ScoredTechnique> ordered = new ArrayList<>();
        for (String id : run.getKnowledgeBase().recommendedTechniques()) {
            ScoredTechnique scored = byId.remove(id);
            if (scored != null) {
                ordered.add(scored);
            }
        }
        ordered.addAll(byId.values());
        return ordered;
    }

    // -- Exploiting role -----------------------------------------------------

    private List<ResolvedAttempt> exploit(RunContext run, int round, CandidatePool pool) {
        AtomicInteger budget = new AtomicInteger(properties.getAttemptsPerRound());
        List<ResolvedAttempt> borderline = Collections.synchronizedList(new ArrayList<>());

        ExecutorService executor = roleExecutor("exploiter", properties.getExploiters());
        for (int i = 1; i <= properties.getExploiters(); i++) {
            String agentId = "exploiter-" + i;
            executor.execute(() -> exploitLoop(run, round, pool, budget, agentId, borderline::add));
        }
        awaitRole(executor, run.getControl(), "exploit");

        synchronized (borderline) {
            return List.copyOf(borderline);
        }
    }

    private void exploitLoop(RunContext run, int round, CandidatePool pool, AtomicInteger budget,
            String agentId, Consumer<ResolvedAttempt> borderline) {
        while (!run.getControl().shouldStop() && budget.getAndDecrement() > 0) {
            List<String> keys = pool.pendingKeys();
            if (keys.isEmpty()) {
                return;
            }

            String armKey;
            try {
                armKey = run.getAllocator().choose(keys);
            } catch (AllocationException e) {
                recordError(run, ErrorKind.ALLOCATION);
                log.warn("{} found no arm to allocate: {}", agentId, e.getMessage());
                return;
            }

            Optional<Payload> next = pool.poll(armKey).or(pool::pollAny);
            if (next.isEmpty()) {
                return;
            }
            Payload payload = next.get();
            AttackAttempt attempt = new AttackAttempt(payload,
                    CandidatePool.armKey(payload, properties.getArmGranularity()), round, agentId, Instant.now());

            if (!attemptOnce(run, attempt, borderline)) {
                return;
            }
        }
    }

    /**
     * Dispatch, classify and record one attempt.
     *
     * @return false when the ledger was sealed and the worker should stop
     */
    private boolean attemptOnce(RunContext run, AttackAttempt attempt, Consumer<ResolvedAttempt> borderline) {
        AttemptLedger ledger = run.getLedger();
        if (!ledger.begin(attempt)) {
            return false;
        }
        metrics.attemptDispatched();

        AgentResponse response;
        Classification classification;
        try {
            response = dispatch(run, attempt.payload(), attempt.agentId(), attempt.round());
            classification = classify(run, attempt.payload(), response);
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                log.debug("{} interrupted during {}; abandoned", attempt.agentId(), attempt.id());
                return false;
            }
            log.error("{} failed on attempt {}: {}", attempt.agentId(), attempt.id(), e.getMessage(), e);
            response = AgentResponse.unreachable("worker error: " + e.getMessage(), Duration.ZERO);
            classification = Classification.indeterminate("worker error");
        }

        Optional<ResolvedAttempt> resolved = ledger.resolve(attempt, response, classification);
        if (resolved.isEmpty()) {
            log.debug("Attempt {} finished after the run was sealed; abandoned", attempt.id());
            return false;
        }

        log.debug("{} {} [{}] -> {} ({})", attempt.agentId(), attempt.id(), attempt.armKey(),
                classification.outcome(), classification.rationale());
        if (classification.isBorderline(properties.getConfidenceThreshold())) {
            borderline.accept(resolved.get());
        } else {
            feedback(run, resolved.get());
        }
        return true;
    }

    private AgentResponse dispatch(RunContext run, Payload payload, String agentId, int round) {
        AgentResponse response;
        try {
            response = targetClient.invoke(payload.content(), Map.of());
        } catch (TargetUnreachableException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw e;
            }
            recordError(run, ErrorKind.TARGET_UNREACHABLE);
            log.warn("{}: target unreachable for {}: {}", agentId, payload.id(), e.getMessage());
            response = AgentResponse.unreachable(e.getMessage(), Duration.ZERO);
        }
        noteAnomaly(run.getKnowledgeBase(), payload, response, agentId, round);
        return response;
    }

    private Classification classify(RunContext run, Payload payload, AgentResponse response) {
        Classification classification = classifier.classify(payload.malicious(), response);
        if (classification.isAmbiguous() && !response.isUnreachable()) {
            recordError(run, ErrorKind.CLASSIFICATION_AMBIGUOUS);
            log.warn("Ambiguous response to {}: {}", payload.id(), classification.rationale());
        }
        return classification;
    }

    private void noteAnomaly(KnowledgeBase kb, Payload payload, AgentResponse response, String agentId, int round) {
        String note = null;
        if (response.isUnreachable()) {
            note = "target unreachable: " + response.failureReason();
        } else if (response.isServerError()) {
            note = "server error status " + response.statusCode();
        } else if (response.latency().compareTo(properties.getSlowResponse()) > 0) {
            note = "slow response " + response.latency().toMillis() + "ms";
        }
        if (note != null) {
            kb.append(agentId, round, InsightType.ANOMALY, payload.id(), note, Map.of(
                    "technique_id", String.valueOf(payload.techniqueId()),
                    "status_code", response.statusCode(),
                    "latency_ms", response.latency().toMillis()));
        }
    }

    /** Reward the arm and archive malicious payloads; indeterminate labels feed nothing back. */
    private void feedback(RunContext run, ResolvedAttempt record) {
        Outcome outcome = record.outcome();
        if (!outcome.isDefinitive()) {
            return;
        }
        run.getAllocator().update(record.attempt().armKey(), outcome.isEvasion());
        Payload payload = record.attempt().payload();
        if (payload.malicious()) {
            run.getMutationEngine().insert(payload, record.response(), outcome.isEvasion());
        }
    }

    // -- Validating role -----------------------------------------------------

    private void validate(RunContext run, int round, List<ResolvedAttempt> borderline) {
        if (borderline.isEmpty()) {
            return;
        }
        List<ResolvedAttempt> ordered = new ArrayList<>(borderline);
        ordered.sort(Comparator.comparing(r -> r.attempt().dispatchedAt()));

        int sampleSize = properties.getValidators() == 0 ? 0
                : Math.min(properties.getValidationSample(), ordered.size());
        Queue<ResolvedAttempt> queue = new ConcurrentLinkedQueue<>(ordered.subList(0, sampleSize));
        ordered.subList(sampleSize, ordered.size()).forEach(record -> feedback(run, record));
        if (queue.isEmpty()) {
            return;
        }

        ExecutorService executor = roleExecutor("validator", properties.getValidators());
        for (int i = 1; i <= properties.getValidators(); i++) {
            String agentId = "validator-" + i;
            executor.execute(() -> {
                ResolvedAttempt record;
                while (!run.getControl().shouldStop() && (record = queue.poll()) != null) {
                    try {
                        revalidate(run, round, record, agentId);
                    } catch (RuntimeException e) {
                        if (Thread.currentThread().isInterrupted()) {
                            feedback(run, record);
                            return;
                        }
                        log.error("{} failed re-checking {}: {}", agentId, record.attempt().id(), e.getMessage(), e);
                    }
                }
            });
        }
        awaitRole(executor, run.getControl(), "validation");

        // records left unchecked after a stop keep their original label
        ResolvedAttempt unchecked;
        while ((unchecked = queue.poll()) != null) {
            feedback(run, unchecked);
        }
    }

    private void revalidate(RunContext run, int round, ResolvedAttempt record, String agentId) {
        Payload payload = record.attempt().payload();
        AgentResponse response = dispatch(run, payload, agentId, round);
        Classification recheck = classify(run, payload, response);

        ResolvedAttempt settled = record;
        if (recheck.outcome().isDefinitive() && recheck.confidence() > record.classification().confidence()) {
            Optional<ResolvedAttempt> replaced = run.getLedger().replace(record.attempt().id(), response, recheck);
            if (replaced.isPresent()) {
                settled = replaced.get();
                log.debug("{} relabelled {}: {} -> {}", agentId, record.attempt().id(),
                        record.outcome(), recheck.outcome());
            }
        }
        feedback(run, settled);
    }

    // -- Counterfactual role -------------------------------------------------

    private void counterfactual(RunContext run, int round) {
        if (properties.getCounterfactualAnalysts() == 0 || properties.getCounterfactualSample() == 0) {
            return;
        }
        Queue<ResolvedAttempt> queue = new ConcurrentLinkedQueue<>(run.getLedger().resolvedInRound(round).stream()
                .filter(r -> r.attempt().payload().malicious() && r.outcome().isDefinitive())
                .sorted(Comparator.comparing((ResolvedAttempt r) -> !r.outcome().isEvasion()))
                .limit(properties.getCounterfactualSample())
                .toList());
        if (queue.isEmpty()) {
            return;
        }

        ExecutorService executor = roleExecutor("counterfactual", properties.getCounterfactualAnalysts());
        for (int i = 1; i <= properties.getCounterfactualAnalysts(); i++) {
            String agentId = "counterfactual-" + i;
            executor.execute(() -> {
                ResolvedAttempt record;
                while (!run.getControl().shouldStop() && (record = queue.poll()) != null) {
                    try {
                        compare(run, round, record, agentId);
                    } catch (RuntimeException e) {
                        if (Thread.currentThread().isInterrupted()) {
                            return;
                        }
                        log.error("{} failed comparing {}: {}", agentId, record.attempt().id(), e.getMessage(), e);
                    }
                }
            });
        }
        awaitRole(executor, run.getControl(), "counterfactual");
    }

    private void compare(RunContext run, int round, ResolvedAttempt record, String agentId) {
        Payload original = record.attempt().payload();
        Payload variant = run.getGenerator().benignVariant(original);
        AgentResponse response = dispatch(run, variant, agentId, round);
        Classification variantLabel = classifier.classify(false, response);
        CounterfactualVerdict verdict = CounterfactualVerdict.of(record.outcome(), variantLabel);

        run.getKnowledgeBase().append(agentId, round, InsightType.COUNTERFACTUAL, original.id(),
                verdict + ": malicious " + record.outcome() + ", benign variant " + variantLabel.outcome(),
                Map.of("verdict", verdict.name(),
                        "technique_id", String.valueOf(original.techniqueId()),
                        "variant_id", variant.id(),
                        "original_outcome", record.outcome().name(),
                        "variant_outcome", variantLabel.outcome().name()));
    }

    // -- Strategy --------------------------------------------------------------

    private void recommend(RunContext run, int round) {
        Map<String, Long> evasions = run.getLedger().resolvedInRound(round).stream()
                .filter(r -> r.outcome().isEvasion())
                .collect(Collectors.groupingBy(r -> r.attempt().payload().techniqueId(), TreeMap::new,
                        Collectors.counting()));

        evasions.forEach((techniqueId, count) -> run.getKnowledgeBase().append(STRATEGIST_ID, round,
                InsightType.TECHNIQUE_RECOMMENDATION, techniqueId,
                count + " evasion(s) in round " + round + ", prioritize in later rounds",
                Map.of("evasions", count)));
        if (!evasions.isEmpty()) {
            log.info("Run {} round {}: recommending {}", run.getRunId(), round, evasions.keySet());
        }
    }

    // -- Worker plumbing -----------------------------------------------------

    private void recordError(RunContext run, ErrorKind kind) {
        run.getErrors().record(kind);
        metrics.error(kind);
    }

    private static ExecutorService roleExecutor(String role, int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread thread = new Thread(r, "sentry-" + role + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Wait for a role's workers. Once a stop is requested, in-flight work gets
     * the grace period before the workers are interrupted.
     */
    private void awaitRole(ExecutorService executor, RunControl control, String role) {
        executor.shutdown();
        try {
            while (!executor.awaitTermination(STOP_POLL_MS, TimeUnit.MILLISECONDS)) {
                if (control.shouldStop()) {
                    Duration grace = properties.getGracePeriod();
                    log.info("Stop requested ({}), allowing {} for in-flight {} work", control.stopReason(),
                            grace, role);
                    if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                        executor.shutdownNow();
                        log.warn("Grace period elapsed, abandoning in-flight {} work", role);
                        executor.awaitTermination(STOP_POLL_MS, TimeUnit.MILLISECONDS);
                    }
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            log.warn("Interrupted while waiting for {} workers", role);
        }
    }
}
