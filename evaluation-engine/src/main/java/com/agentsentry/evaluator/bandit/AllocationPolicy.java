package com.agentsentry.evaluator.bandit;

import java.util.List;
import java.util.Random;

/**
 * Picks the arm to spend the next attempt on.
 *
 * @author Naveed Gung
 */
public interface AllocationPolicy {

    /**
     * @param arms   eligible arms, in a stable order
     * @param random the allocator's seeded source
     * @return key of the chosen arm
     * @throws AllocationException if no arm can be chosen
     */
    String choose(List<ArmSnapshot> arms, Random random);

    String name();
}
