package com.agentsentry.evaluator.orchestration;

import com.agentsentry.evaluator.bandit.BanditAllocator;
import com.agentsentry.evaluator.knowledge.KnowledgeBase;
import com.agentsentry.evaluator.mutation.MutationEngine;
import com.agentsentry.evaluator.payload.PayloadGenerator;
import com.agentsentry.evaluator.scoring.ScoredTechnique;
import com.agentsentry.evaluator.target.TargetProfile;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State containers of one run, handed to the role workers by reference.
 * Each container guards its own updates.
 *
 * @author Naveed Gung
 */
public class RunContext {

    private final String runId;
    private final TargetProfile target;
    private final RunControl control;
    private final Instant startedAt;
    private final RunStateMachine stateMachine;
    private final AttemptLedger ledger = new AttemptLedger();
    private final ErrorTally errors = new ErrorTally();
    private final KnowledgeBase knowledgeBase = new KnowledgeBase();
    private final BanditAllocator allocator;
    private final MutationEngine mutationEngine;
    private final PayloadGenerator generator;
    private final AtomicInteger roundsCompleted = new AtomicInteger();
    private final Set<String> unproducible = ConcurrentHashMap.newKeySet();

    private volatile List<ScoredTechnique> activeTechniques = List.of();
    private volatile Instant finishedAt;

    public RunContext(String runId, TargetProfile target, RunControl control, BanditAllocator allocator,
            MutationEngine mutationEngine, PayloadGenerator generator) {
        this.runId = runId;
        this.target = target;
        this.control = control;
        this.allocator = allocator;
        this.mutationEngine = mutationEngine;
        this.generator = generator;
        this.startedAt = Instant.now();
        this.stateMachine = new RunStateMachine(runId);
    }

    public String getRunId() {
        return runId;
    }

    public TargetProfile getTarget() {
        return target;
    }

    public RunControl getControl() {
        return control;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    void markFinished() {
        this.finishedAt = Instant.now();
    }

    public RunStateMachine getStateMachine() {
        return stateMachine;
    }

    public AttemptLedger getLedger() {
        return ledger;
    }

    public ErrorTally getErrors() {
        return errors;
    }

    public KnowledgeBase getKnowledgeBase() {
        return knowledgeBase;
    }

    public BanditAllocator getAllocator() {
        return allocator;
    }

    public MutationEngine getMutationEngine() {
        return mutationEngine;
    }

    public PayloadGenerator getGenerator() {
        return generator;
    }

    public List<ScoredTechnique> getActiveTechniques() {
        return activeTechniques;
    }

    void setActiveTechniques(List<ScoredTechnique> activeTechniques) {
        this.activeTechniques = List.copyOf(activeTechniques);
    }

    /** Techniques the generator could not instantiate; not retried. */
    public Set<String> getUnproducible() {
        return unproducible;
    }

    public int getRoundsCompleted() {
        return roundsCompleted.get();
    }

    void completeRound() {
        roundsCompleted.incrementAndGet();
    }
}
