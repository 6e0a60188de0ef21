package org.Aayush.tsp.search;

import lombok.experimental.UtilityClass;

import java.util.random.RandomGenerator;

@UtilityClass
public final class RandomTours {

    /**
     * Returns a uniformly random permutation of {@code 0..n-1} (Fisher-Yates).
     */
    public static int[] shuffled(int n, RandomGenerator random) {
        int[] route = new int[n];
        for (int k = 0; k < n; k++) {
            route[k] = k;
        }
        for (int k = n - 1; k > 0; k--) {
            int other = random.nextInt(k + 1);
            int tmp = route[k];
            route[k] = route[other];
            route[other] = tmp;
        }
        return route;
    }
}
