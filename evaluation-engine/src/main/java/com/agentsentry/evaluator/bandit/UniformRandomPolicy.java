package com.agentsentry.evaluator.bandit;

import java.util.List;
import java.util.Random;

/**
 * Baseline policy: every eligible arm is equally likely.
 *
 * @author Naveed Gung
 */
public class UniformRandomPolicy implements AllocationPolicy {

    @Override
    public String choose(List<ArmSnapshot> arms, Random random) {
        if (arms.isEmpty()) {
            throw new AllocationException("No eligible arms to choose from");
        }
        return arms.get(random.nextInt(arms.size())).key();
    }

    @Override
    public String name() {
        return "uniform";
    }
}
