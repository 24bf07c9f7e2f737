package com.agentsentry.evaluator.orchestration;

import com.agentsentry.evaluator.classification.Classification;
import com.agentsentry.evaluator.classification.ConfusionMatrix;
import com.agentsentry.evaluator.target.AgentResponse;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tracks every attempt of a run and its single terminal classification.
 *
 * <p>
 * Once {@link #seal() sealed}, late resolutions are refused: attempts still
 * in flight at that point are reported as abandoned instead of being
 * counted in the confusion matrix.
 * </p>
 *
 * @author Naveed Gung
 */
public class AttemptLedger {

    private final Map<String, AttackAttempt> inFlight = new LinkedHashMap<>();
    private final Map<String, ResolvedAttempt> resolved = new LinkedHashMap<>();
    private boolean sealed;
    private int abandoned;

    /**
     * Register a dispatched attempt.
     *
     * @return false when the ledger is sealed and the attempt must not be
     *         dispatched
     */
    public synchronized boolean begin(AttackAttempt attempt) {
        if (sealed) {
            return false;
        }
        if (inFlight.containsKey(attempt.id()) || resolved.containsKey(attempt.id())) {
            throw new IllegalStateException("Payload " + attempt.id() + " was already dispatched");
        }
        inFlight.put(attempt.id(), attempt);
        return true;
    }

    /**
     * Attach the terminal classification to an in-flight attempt.
     *
     * @return the resolved attempt, or empty when the ledger was sealed first
     */
    public synchronized Optional<ResolvedAttempt> resolve(
            AttackAttempt attempt, AgentResponse response, Classification classification) {
        if (sealed || inFlight.remove(attempt.id()) == null) {
            return Optional.empty();
        }
        ResolvedAttempt record = new ResolvedAttempt(attempt, response, classification, false);
        resolved.put(attempt.id(), record);
        return Optional.of(record);
    }

    /**
     * Replace the classification of a resolved attempt after a re-check.
     */
    public synchronized Optional<ResolvedAttempt> replace(
            String attemptId, AgentResponse response, Classification classification) {
        ResolvedAttempt current = resolved.get(attemptId);
        if (sealed || current == null) {
            return Optional.empty();
        }
        ResolvedAttempt record = new ResolvedAttempt(current.attempt(), response, classification, true);
        resolved.put(attemptId, record);
        return Optional.of(record);
    }

    /**
     * Stop accepting attempts; anything still in flight is abandoned.
     *
     * @return number of abandoned attempts
     */
    public synchronized int seal() {
        if (!sealed) {
            sealed = true;
            abandoned = inFlight.size();
            inFlight.clear();
        }
        return abandoned;
    }

    public synchronized List<ResolvedAttempt> resolved() {
        return List.copyOf(resolved.values());
    }

    public synchronized List<ResolvedAttempt> resolvedInRound(int round) {
        List<ResolvedAttempt> records = new ArrayList<>();
        for (ResolvedAttempt record : resolved.values()) {
            if (record.attempt().round() == round) {
                records.add(record);
            }
        }
        records.sort(Comparator.comparing(r -> r.attempt().dispatchedAt()));
        return records;
    }

    public synchronized Optional<ResolvedAttempt> find(String attemptId) {
        return Optional.ofNullable(resolved.get(attemptId));
    }

    public synchronized ConfusionMatrix matrix() {
        return ConfusionMatrix.of(resolved.values().stream().map(ResolvedAttempt::outcome).toList());
    }

    public synchronized int inFlightCount() {
        return inFlight.size();
    }

    public synchronized int getAbandoned() {
        return abandoned;
    }

    public synchronized boolean isSealed() {
        return sealed;
    }
}
