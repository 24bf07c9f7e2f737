package com.agentsentry.evaluator.mutation;

import com.agentsentry.evaluator.payload.Payload;

/**
 * Archived payload with its behavioural signature and novelty fitness.
 *
 * @param payload    the archived payload
 * @param signature  signature of the response it provoked
 * @param fitness    distance to the nearest other archived signature, plus the
 *                   evasion bonus
 * @param generation mutation depth of the payload
 * @param evasion    whether the payload evaded detection
 * @param sequence   insertion order, used to evict the oldest on ties
 *
 * @author Naveed Gung
 */
public record NoveltyArchiveEntry(
        Payload payload,
        BehaviorSignature signature,
        double fitness,
        int generation,
        boolean evasion,
        long sequence) {

    NoveltyArchiveEntry withFitness(double updated) {
        return new NoveltyArchiveEntry(payload, signature, updated, generation, evasion, sequence);
    }

    public String payloadId() {
        return payload.id();
    }
}
