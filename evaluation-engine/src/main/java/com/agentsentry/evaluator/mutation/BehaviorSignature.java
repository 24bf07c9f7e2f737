package com.agentsentry.evaluator.mutation;

import com.agentsentry.evaluator.target.AgentResponse;

import java.util.Locale;

/**
 * Behavioural fingerprint of a target response: the observable action, and
 * whether state changed and the target reported success.
 *
 * @author Naveed Gung
 */
public record BehaviorSignature(String action, boolean stateChanged, boolean success) {

    /** Largest possible {@link #distance(BehaviorSignature)}. */
    public static final int MAX_DISTANCE = 3;

    public BehaviorSignature {
        action = action == null || action.isBlank() ? "none" : action.trim().toLowerCase(Locale.ROOT);
    }

    public static BehaviorSignature of(AgentResponse response) {
        if (response.isUnreachable()) {
            return new BehaviorSignature("unreachable", false, false);
        }
        return new BehaviorSignature(response.actionTaken(), response.hasStateChanges(), response.success());
    }

    /** Number of differing components, 0 to 3. */
    public int distance(BehaviorSignature other) {
        int d = 0;
        if (!action.equals(other.action)) {
            d++;
        }
        if (stateChanged != other.stateChanged) {
            d++;
        }
        if (success != other.success) {
            d++;
        }
        return d;
    }
}
