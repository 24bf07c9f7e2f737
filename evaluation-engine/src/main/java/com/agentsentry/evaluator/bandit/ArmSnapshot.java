package com.agentsentry.evaluator.bandit;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Consistent point-in-time view of an {@link Arm}.
 *
 * @param key         category or technique id
 * @param successes   rewarded observations
 * @param failures    unrewarded observations
 * @param allocations times the allocator chose this arm
 *
 * @author Naveed Gung
 */
public record ArmSnapshot(String key, long successes, long failures, long allocations) {

    /** Observations that contributed a reward update. */
    @JsonProperty
    public long pulls() {
        return successes + failures;
    }

    public double alpha() {
        return successes + 1.0;
    }

    public double beta() {
        return failures + 1.0;
    }

    @JsonProperty
    public double posteriorMean() {
        return alpha() / (alpha() + beta());
    }
}
