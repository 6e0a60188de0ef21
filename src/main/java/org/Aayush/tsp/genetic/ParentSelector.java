package org.Aayush.tsp.genetic;

import it.unimi.dsi.fastutil.ints.IntArrays;
import org.Aayush.tsp.config.ParameterMap;

import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Picks parent indices from a population's cost vector.
 *
 * <p>Lower cost is fitter. Degenerate weight vectors (all equal, or not summing to a positive finite
 * total) fall back to uniform selection.</p>
 */
public final class ParentSelector {
    static final double ROULETTE_EPSILON = 1e-9d;

    private final SelectionType type;
    private final int tournamentSize;

    public ParentSelector(SelectionType type, int tournamentSize) {
        this.type = Objects.requireNonNull(type, "type");
        this.tournamentSize = ParameterMap.requireAtLeast(
                GeneticAlgorithmConfig.TOURNAMENT_SIZE,
                tournamentSize,
                1
        );
    }

    /**
     * Returns the index of one selected individual.
     */
    public int select(double[] costs, RandomGenerator random) {
        return switch (type) {
            case TOURNAMENT -> tournament(costs, random);
            case ROULETTE -> roulette(costs, random);
            case RANKING -> ranking(costs, random);
        };
    }

    private int tournament(double[] costs, RandomGenerator random) {
        int size = costs.length;
        int k = Math.min(tournamentSize, size);
        int[] pool = new int[size];
        for (int idx = 0; idx < size; idx++) {
            pool[idx] = idx;
        }
        int winner = -1;
        for (int draw = 0; draw < k; draw++) {
            int pick = draw + random.nextInt(size - draw);
            int candidate = pool[pick];
            pool[pick] = pool[draw];
            pool[draw] = candidate;
            if (winner < 0 || costs[candidate] < costs[winner]) {
                winner = candidate;
            }
        }
        return winner;
    }

    private int roulette(double[] costs, RandomGenerator random) {
        int size = costs.length;
        double[] weights = new double[size];
        double total = 0.0d;
        boolean allEqual = true;
        for (int idx = 0; idx < size; idx++) {
            weights[idx] = 1.0d / (costs[idx] + ROULETTE_EPSILON);
            total += weights[idx];
            if (weights[idx] != weights[0]) {
                allEqual = false;
            }
        }
        if (allEqual || !Double.isFinite(total) || total <= 0.0d) {
            return random.nextInt(size);
        }
        double target = random.nextDouble() * total;
        double cumulative = 0.0d;
        for (int idx = 0; idx < size; idx++) {
            cumulative += weights[idx];
            if (target < cumulative) {
                return idx;
            }
        }
        return size - 1;
    }

    private int ranking(double[] costs, RandomGenerator random) {
        int size = costs.length;
        int[] order = new int[size];
        for (int idx = 0; idx < size; idx++) {
            order[idx] = idx;
        }
        IntArrays.mergeSort(order, (a, b) -> Double.compare(costs[a], costs[b]));

        // rank r (0 = best) carries weight size - r
        long total = (long) size * (size + 1) / 2L;
        long target = random.nextLong(total);
        long cumulative = 0L;
        for (int rank = 0; rank < size; rank++) {
            cumulative += size - rank;
            if (target < cumulative) {
                return order[rank];
            }
        }
        return order[size - 1];
    }
}
