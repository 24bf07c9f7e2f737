package com.agentsentry.evaluator.orchestration;

import com.agentsentry.evaluator.payload.Payload;

import java.time.Instant;

/**
 * One dispatch of a payload to the target.
 *
 * @param payload      the payload, consumed by this attempt
 * @param armKey       bandit arm the budget was charged to
 * @param round        1-based round number
 * @param agentId      id of the issuing worker
 * @param dispatchedAt dispatch time
 *
 * @author Naveed Gung
 */
public record AttackAttempt(Payload payload, String armKey, int round, String agentId, Instant dispatchedAt) {

    public String id() {
        return payload.id();
    }
}
