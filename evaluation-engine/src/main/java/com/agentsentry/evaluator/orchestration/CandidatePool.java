package com.agentsentry.evaluator.orchestration;

import com.agentsentry.evaluator.bandit.ArmGranularity;
import com.agentsentry.evaluator.payload.Payload;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Payloads proposed for one round, queued per bandit arm.
 *
 * @author Naveed Gung
 */
public class CandidatePool {

    private final ArmGranularity granularity;
    private final Map<String, Deque<Payload>> queues = new TreeMap<>();

    public CandidatePool(ArmGranularity granularity) {
        this.granularity = granularity;
    }

    /** Arm key a payload is charged to. Controls always share one arm. */
    public static String armKey(Payload payload, ArmGranularity granularity) {
        if (payload.isControl()) {
            return Payload.CONTROL_CATEGORY;
        }
        return granularity == ArmGranularity.TECHNIQUE ? payload.techniqueId() : payload.category();
    }

    public synchronized void addAll(Collection<Payload> payloads) {
        for (Payload payload : payloads) {
            queues.computeIfAbsent(armKey(payload, granularity), k -> new ArrayDeque<>()).addLast(payload);
        }
    }

    /** Arms that still have payloads, in key order. */
    public synchronized List<String> pendingKeys() {
        return queues.entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .map(Map.Entry::getKey)
                .toList();
    }

    public synchronized Optional<Payload> poll(String armKey) {
        Deque<Payload> queue = queues.get(armKey);
        return queue == null ? Optional.empty() : Optional.ofNullable(queue.pollFirst());
    }

    /** First payload of the first non-empty arm. */
    public synchronized Optional<Payload> pollAny() {
        for (Deque<Payload> queue : queues.values()) {
            if (!queue.isEmpty()) {
                return Optional.of(queue.pollFirst());
            }
        }
        return Optional.empty();
    }

    public synchronized int size() {
        return queues.values().stream().mapToInt(Deque::size).sum();
    }

    public synchronized boolean isEmpty() {
        return size() == 0;
    }
}
