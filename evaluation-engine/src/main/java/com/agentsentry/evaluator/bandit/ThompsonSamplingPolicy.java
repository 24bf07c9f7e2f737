package com.agentsentry.evaluator.bandit;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Thompson Sampling over Beta(successes + 1, failures + 1) posteriors.
 *
 * <p>
 * One draw per arm; the maximum wins. Arms with exactly equal draws are
 * collected and one is picked with the seeded source.
 * </p>
 *
 * @author Naveed Gung
 */
public class ThompsonSamplingPolicy implements AllocationPolicy {

    @Override
    public String choose(List<ArmSnapshot> arms, Random random) {
        if (arms.isEmpty()) {
            throw new AllocationException("No eligible arms to sample");
        }

        double best = Double.NEGATIVE_INFINITY;
        List<String> tied = new ArrayList<>();
        for (ArmSnapshot arm : arms) {
            double draw = BetaSampler.sample(random, arm.alpha(), arm.beta());
            if (Double.isNaN(draw)) {
                continue;
            }
            if (draw > best) {
                best = draw;
                tied.clear();
                tied.add(arm.key());
            } else if (draw == best) {
                tied.add(arm.key());
            }
        }

        if (tied.isEmpty()) {
            throw new AllocationException("Posterior draws were not finite for " + arms.size() + " arms");
        }
        return tied.size() == 1 ? tied.get(0) : tied.get(random.nextInt(tied.size()));
    }

    @Override
    public String name() {
        return "thompson";
    }
}
