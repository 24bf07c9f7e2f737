package com.agentsentry.evaluator.mutation;

import com.agentsentry.evaluator.payload.Payload;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Bounded archive of novel payloads.
 *
 * <p>
 * Insertion and eviction form a single critical section. An entry's fitness
 * is its distance to the nearest other archived signature plus the evasion
 * bonus, and is recomputed for every entry whenever the membership changes.
 * When the archive is full, a candidate whose fitness does not exceed the
 * current minimum is rejected; otherwise the lowest-fitness entry (oldest on
 * ties) is evicted.
 * </p>
 *
 * @author Naveed Gung
 */
public class NoveltyArchive {

    private static final Comparator<NoveltyArchiveEntry> EVICTION_ORDER = Comparator
            .comparingDouble(NoveltyArchiveEntry::fitness)
            .thenComparingLong(NoveltyArchiveEntry::sequence);

    private final int capacity;
    private final double evasionBonus;
    private final List<NoveltyArchiveEntry> entries = new ArrayList<>();
    private long sequence;
    private long evictions;

    public NoveltyArchive(int capacity, double evasionBonus) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Archive capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.evasionBonus = evasionBonus;
    }

    /**
     * Score a candidate against the current archive and insert it if it
     * qualifies.
     *
     * @param payload   the candidate payload
     * @param signature its behavioural signature
     * @param evasion   whether it evaded detection
     * @return the inserted entry with its fitness after the insertion, or
     *         empty when rejected
     */
    public synchronized Optional<NoveltyArchiveEntry> offer(Payload payload, BehaviorSignature signature,
            boolean evasion) {
        double fitness = fitness(nearestDistance(signature), evasion);

        if (entries.size() >= capacity) {
            NoveltyArchiveEntry weakest = entries.stream().min(EVICTION_ORDER).orElseThrow();
            if (fitness <= weakest.fitness()) {
                return Optional.empty();
            }
            entries.remove(weakest);
            evictions++;
        }

        long id = ++sequence;
        entries.add(new NoveltyArchiveEntry(payload, signature, fitness, payload.generation(), evasion, id));
        rescore();
        return entries.stream().filter(e -> e.sequence() == id).findFirst();
    }

    /**
     * Distance from the signature to its nearest archived neighbour;
     * {@link BehaviorSignature#MAX_DISTANCE} for an empty archive.
     */
    public synchronized int nearestDistance(BehaviorSignature signature) {
        int nearest = BehaviorSignature.MAX_DISTANCE;
        for (NoveltyArchiveEntry entry : entries) {
            nearest = Math.min(nearest, entry.signature().distance(signature));
        }
        return nearest;
    }

    public synchronized List<NoveltyArchiveEntry> snapshot() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long getEvictions() {
        return evictions;
    }

    private double fitness(int nearest, boolean evasion) {
        return nearest + (evasion ? evasionBonus : 0.0);
    }

    /** Caller holds the lock. */
    private void rescore() {
        for (int i = 0; i < entries.size(); i++) {
            NoveltyArchiveEntry entry = entries.get(i);
            int nearest = BehaviorSignature.MAX_DISTANCE;
            for (int j = 0; j < entries.size(); j++) {
                if (i != j) {
                    nearest = Math.min(nearest, entries.get(j).signature().distance(entry.signature()));
                }
            }
            entries.set(i, entry.withFitness(fitness(nearest, entry.evasion())));
        }
    }
}
