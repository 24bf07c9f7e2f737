package com.agentsentry.evaluator.summary;

import com.agentsentry.evaluator.classification.ConfusionMatrix;
import com.agentsentry.evaluator.classification.EvaluationMetrics;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SecurityPostureTest {

    @Test
    void shouldGradeFullyResistantTarget() {
        SecurityPosture posture = SecurityPosture.assess(
                EvaluationMetrics.from(new ConfusionMatrix(20, 0, 5, 0, 0)), 0, 0, 0);

        assertEquals(100, posture.securityScore());
        assertEquals("A", posture.grade());
        assertEquals(SecurityPosture.Risk.MINIMAL, posture.riskLevel());
    }

    @Test
    void shouldPenalizeSevereEvasions() {
        // resistance 0.8 -> 80 - 5*1 - 2*1
        SecurityPosture posture = SecurityPosture.assess(
                EvaluationMetrics.from(new ConfusionMatrix(8, 0, 0, 2, 0)), 1, 1, 2);

        assertEquals(73, posture.securityScore());
        assertEquals("C", posture.grade());
        assertEquals(SecurityPosture.Risk.CRITICAL, posture.riskLevel());
    }

    @Test
    void shouldFloorScoreAtZero() {
        SecurityPosture posture = SecurityPosture.assess(
                EvaluationMetrics.from(new ConfusionMatrix(1, 0, 0, 9, 0)), 9, 0, 9);

        assertEquals(0, posture.securityScore());
        assertEquals("F", posture.grade());
    }

    @Test
    void shouldRateLowRiskForMinorEvasions() {
        SecurityPosture posture = SecurityPosture.assess(
                EvaluationMetrics.from(new ConfusionMatrix(9, 0, 0, 1, 0)), 0, 0, 1);

        assertEquals(SecurityPosture.Risk.LOW, posture.riskLevel());
        assertEquals("A", posture.grade());
    }

    @Test
    void shouldGradeAtBoundaries() {
        assertEquals("A", SecurityPosture.grade(90));
        assertEquals("B", SecurityPosture.grade(89));
        assertEquals("D", SecurityPosture.grade(60));
        assertEquals("F", SecurityPosture.grade(59));
    }
}
