package com.agentsentry.evaluator.orchestration;

import com.agentsentry.evaluator.bandit.ArmGranularity;
import com.agentsentry.evaluator.classification.Classification;
import com.agentsentry.evaluator.classification.Outcome;
import com.agentsentry.evaluator.payload.Payload;
import com.agentsentry.evaluator.payload.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CandidatePoolTest {

    private CandidatePool pool;

    @BeforeEach
    void setUp() {
        pool = new CandidatePool(ArmGranularity.CATEGORY);
    }

    @Test
    void shouldQueuePayloadsPerArm() {
        pool.addAll(List.of(
                payload("P-1", "T1059", "execution"),
                payload("P-2", "T1485", "impact"),
                payload("P-3", "T1059", Payload.CONTROL_CATEGORY),
                payload("P-4", "T1059", "execution")));

        assertEquals(List.of("benign-control", "execution", "impact"), pool.pendingKeys());
        assertEquals("P-1", pool.poll("execution").orElseThrow().id());
        assertEquals("P-4", pool.poll("execution").orElseThrow().id());
        assertTrue(pool.poll("execution").isEmpty());
        assertEquals(List.of("benign-control", "impact"), pool.pendingKeys());
    }

    @Test
    void shouldDrainAnyArm() {
        pool.addAll(List.of(payload("P-1", "T1059", "execution"), payload("P-2", "T1485", "impact")));

        assertTrue(pool.pollAny().isPresent());
        assertTrue(pool.pollAny().isPresent());
        assertTrue(pool.pollAny().isEmpty());
        assertTrue(pool.isEmpty());
    }

    @Test
    void shouldKeyByTechniqueWhenConfigured() {
        Payload attack = payload("P-1", "T1059", "execution");
        Payload control = payload("P-2", "T1059", Payload.CONTROL_CATEGORY);

        assertEquals("T1059", CandidatePool.armKey(attack, ArmGranularity.TECHNIQUE));
        assertEquals("benign-control", CandidatePool.armKey(control, ArmGranularity.TECHNIQUE));
    }

    @Test
    void shouldJudgeCounterfactualComparisons() {
        assertEquals(CounterfactualVerdict.LABEL_CONFIRMED,
                CounterfactualVerdict.of(Outcome.TRUE_POSITIVE, label(Outcome.TRUE_NEGATIVE)));
        assertEquals(CounterfactualVerdict.DETECTION_NONSPECIFIC,
                CounterfactualVerdict.of(Outcome.TRUE_POSITIVE, label(Outcome.FALSE_POSITIVE)));
        assertEquals(CounterfactualVerdict.LABEL_QUESTIONABLE,
                CounterfactualVerdict.of(Outcome.FALSE_NEGATIVE, label(Outcome.TRUE_NEGATIVE)));
        assertEquals(CounterfactualVerdict.INCONCLUSIVE,
                CounterfactualVerdict.of(Outcome.TRUE_POSITIVE, Classification.indeterminate("unreachable")));
    }

    private static Classification label(Outcome outcome) {
        return new Classification(outcome, "test", 0.9);
    }

    private static Payload payload(String id, String techniqueId, String category) {
        boolean control = Payload.CONTROL_CATEGORY.equals(category);
        return new Payload(id, "content " + id, techniqueId, category, !control,
                control ? Severity.LOW : Severity.HIGH, null, 0);
    }
}
