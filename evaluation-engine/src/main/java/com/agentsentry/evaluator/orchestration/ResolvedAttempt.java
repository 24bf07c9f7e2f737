package com.agentsentry.evaluator.orchestration;

import com.agentsentry.evaluator.classification.Classification;
import com.agentsentry.evaluator.classification.Outcome;
import com.agentsentry.evaluator.target.AgentResponse;

/**
 * An attempt with its terminal classification.
 *
 * @param attempt        the attempt
 * @param response       the response the classification was based on
 * @param classification the terminal label
 * @param revalidated    true when a validator replaced the first label
 *
 * @author Naveed Gung
 */
public record ResolvedAttempt(
        AttackAttempt attempt,
        AgentResponse response,
        Classification classification,
        boolean revalidated) {

    public Outcome outcome() {
        return classification.outcome();
    }
}
