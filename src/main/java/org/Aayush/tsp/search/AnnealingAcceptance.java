package org.Aayush.tsp.search;

import lombok.experimental.UtilityClass;

import java.util.random.RandomGenerator;

/**
 * Metropolis acceptance rule.
 */
@UtilityClass
public final class AnnealingAcceptance {

    /**
     * Probability of accepting a move with cost change {@code delta} at temperature {@code temperature}.
     *
     * @return 1 for improving moves, {@code exp(-delta / temperature)} otherwise.
     */
    public static double acceptanceProbability(double delta, double temperature) {
        if (delta < 0.0d) {
            return 1.0d;
        }
        return Math.exp(-delta / temperature);
    }

    /**
     * Decides acceptance. Improving moves are accepted without consuming a random draw; all others
     * consume exactly one uniform {@code [0,1)} draw.
     */
    public static boolean accepts(double delta, double temperature, RandomGenerator random) {
        if (delta < 0.0d) {
            return true;
        }
        return random.nextDouble() < Math.exp(-delta / temperature);
    }
}
