package com.agentsentry.evaluator.bandit;

import java.util.Random;

/**
 * Beta variates built from two Gamma draws (Marsaglia and Tsang).
 *
 * @author Naveed Gung
 */
final class BetaSampler {

    private BetaSampler() {
    }

    static double sample(Random random, double alpha, double beta) {
        double x = gamma(random, alpha);
        double y = gamma(random, beta);
        double sum = x + y;
        return sum == 0.0 ? 0.5 : x / sum;
    }

    static double gamma(Random random, double shape) {
        if (shape <= 0.0) {
            throw new IllegalArgumentException("Gamma shape must be positive: " + shape);
        }
        if (shape < 1.0) {
            double u = random.nextDouble();
            return gamma(random, shape + 1.0) * Math.pow(u, 1.0 / shape);
        }

        double d = shape - 1.0 / 3.0;
        double c = 1.0 / Math.sqrt(9.0 * d);
        while (true) {
            double x;
            double v;
            do {
                x = random.nextGaussian();
                v = 1.0 + c * x;
            } while (v <= 0.0);

            v = v * v * v;
            double u = random.nextDouble();
            if (u < 1.0 - 0.0331 * x * x * x * x) {
                return d * v;
            }
            if (Math.log(u) < 0.5 * x * x + d * (1.0 - v + Math.log(v))) {
                return d * v;
            }
        }
    }
}
