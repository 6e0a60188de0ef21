package org.Aayush.tsp.genetic;

import java.util.Arrays;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Permutation-preserving recombination of two parent routes.
 *
 * <p>Slice-based operators (OX, PMX) copy {@code parent1[i..j-1]} for a random {@code i < j}. Children
 * are always permutations of {@code 0..n-1}, including when both parents are the same route.</p>
 */
public final class Crossover {
    private static final int EMPTY = -1;

    private final CrossoverType type;

    public Crossover(CrossoverType type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public int[] cross(int[] parent1, int[] parent2, RandomGenerator random) {
        if (type == CrossoverType.CX) {
            return cycle(parent1, parent2);
        }
        int n = parent1.length;
        int i = random.nextInt(n);
        int j = random.nextInt(n - 1);
        if (j >= i) {
            j++;
        }
        if (i > j) {
            int tmp = i;
            i = j;
            j = tmp;
        }
        return type == CrossoverType.OX
                ? order(parent1, parent2, i, j)
                : partiallyMapped(parent1, parent2, i, j);
    }

    /**
     * Order crossover: keeps {@code parent1[i..j-1]} in place, then writes the remaining cities in
     * {@code parent2} order starting at position {@code j} and wrapping to 0.
     */
    static int[] order(int[] parent1, int[] parent2, int i, int j) {
        int n = parent1.length;
        int[] child = new int[n];
        boolean[] used = new boolean[n];
        for (int k = i; k < j; k++) {
            child[k] = parent1[k];
            used[parent1[k]] = true;
        }
        int pos = j;
        for (int city : parent2) {
            if (used[city]) {
                continue;
            }
            if (pos == n) {
                pos = 0;
            }
            child[pos++] = city;
            used[city] = true;
        }
        return child;
    }

    /**
     * Partially matched crossover: keeps {@code parent1[i..j-1]} in place. Each displaced
     * {@code parent2} city from that range follows the mapping {@code pos -> indexOf(parent2, parent1[pos])}
     * until it reaches a free slot. Remaining slots are copied from {@code parent2}.
     */
    static int[] partiallyMapped(int[] parent1, int[] parent2, int i, int j) {
        int n = parent1.length;
        int[] child = new int[n];
        Arrays.fill(child, EMPTY);
        boolean[] used = new boolean[n];
        int[] positionInParent2 = positions(parent2);
        for (int k = i; k < j; k++) {
            child[k] = parent1[k];
            used[parent1[k]] = true;
        }
        for (int k = i; k < j; k++) {
            int city = parent2[k];
            if (used[city]) {
                continue;
            }
            int pos = k;
            while (child[pos] != EMPTY) {
                pos = positionInParent2[parent1[pos]];
            }
            child[pos] = city;
            used[city] = true;
        }
        for (int k = 0; k < n; k++) {
            if (child[k] == EMPTY) {
                child[k] = parent2[k];
            }
        }
        return child;
    }

    /**
     * Cycle crossover: positions on the cycle through index 0 come from {@code parent1}, every other
     * position from {@code parent2}.
     */
    static int[] cycle(int[] parent1, int[] parent2) {
        int n = parent1.length;
        int[] positionInParent1 = positions(parent1);
        boolean[] inCycle = new boolean[n];
        int idx = 0;
        while (!inCycle[idx]) {
            inCycle[idx] = true;
            idx = positionInParent1[parent2[idx]];
        }
        int[] child = new int[n];
        for (int k = 0; k < n; k++) {
            child[k] = inCycle[k] ? parent1[k] : parent2[k];
        }
        return child;
    }

    private static int[] positions(int[] route) {
        int[] positions = new int[route.length];
        for (int k = 0; k < route.length; k++) {
            positions[route[k]] = k;
        }
        return positions;
    }
}
