package com.agentsentry.evaluator.target;

import java.time.Duration;
import java.util.Map;

/**
 * Response of the target to one command invocation.
 *
 * <p>
 * Only {@code actionTaken} and {@code stateChanges} are relevant to
 * blocked/executed classification; the remaining fields are carried for the
 * behavioural signature, anomaly notes and the report. Unreachability is
 * never read from the target's own fields: only {@link #unreachable} sets
 * {@code failureReason}.
 * </p>
 *
 * @param statusCode   HTTP status, or 0 when the target was unreachable
 * @param latency      round-trip time of the final try
 * @param success      the target's own success flag
 * @param actionTaken  observable action reported by the target (may be null)
 * @param details      opaque details map
 * @param stateChanges state changes the command caused
 * @param timestamp    target-side timestamp string (opaque)
 * @param failureReason why no answer arrived, or null when the target answered
 *
 * @author Naveed Gung
 */
public record AgentResponse(
        int statusCode,
        Duration latency,
        boolean success,
        String actionTaken,
        Map<String, Object> details,
        Map<String, Object> stateChanges,
        String timestamp,
        String failureReason) {

    public AgentResponse {
        latency = latency == null ? Duration.ZERO : latency;
        details = details == null ? Map.of() : Map.copyOf(details);
        stateChanges = stateChanges == null ? Map.of() : Map.copyOf(stateChanges);
    }

    /** Response the target actually sent. */
    public AgentResponse(int statusCode, Duration latency, boolean success, String actionTaken,
            Map<String, Object> details, Map<String, Object> stateChanges, String timestamp) {
        this(statusCode, latency, success, actionTaken, details, stateChanges, timestamp, null);
    }

    /** Factory for a target that never answered. */
    public static AgentResponse unreachable(String reason, Duration latency) {
        return new AgentResponse(0, latency, false, null, Map.of(), Map.of(), null,
                reason == null ? "unknown" : reason);
    }

    public boolean isUnreachable() {
        return failureReason != null;
    }

    public boolean hasStateChanges() {
        return !stateChanges.isEmpty();
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }
}
