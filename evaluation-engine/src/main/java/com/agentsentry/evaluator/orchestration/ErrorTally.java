package com.agentsentry.evaluator.orchestration;

import com.agentsentry.evaluator.ErrorKind;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Attempt-scoped error counts of a run.
 *
 * @author Naveed Gung
 */
public class ErrorTally {

    private final Map<ErrorKind, AtomicLong> counts = new EnumMap<>(ErrorKind.class);

    public ErrorTally() {
        for (ErrorKind kind : ErrorKind.values()) {
            counts.put(kind, new AtomicLong());
        }
    }

    public void record(ErrorKind kind) {
        counts.get(kind).incrementAndGet();
    }

    /** Snapshot keyed by lower-case kind name. */
    public Map<String, Long> snapshot() {
        Map<String, Long> snapshot = new LinkedHashMap<>();
        counts.forEach((kind, count) -> snapshot.put(kind.name().toLowerCase(Locale.ROOT), count.get()));
        return snapshot;
    }
}
