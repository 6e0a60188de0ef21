package org.Aayush.tsp.genetic;

import org.Aayush.tsp.cost.DistanceMatrix;
import org.Aayush.tsp.cost.TourCost;
import org.Aayush.tsp.search.RandomTours;

import java.util.random.RandomGenerator;

/**
 * One generation: routes with their full tour costs at matching indices.
 */
final class Population {
    private final int[][] routes;
    private final double[] costs;

    private Population(int[][] routes, double[] costs) {
        this.routes = routes;
        this.costs = costs;
    }

    static Population random(DistanceMatrix matrix, int size, RandomGenerator random) {
        int[][] routes = new int[size][];
        for (int k = 0; k < size; k++) {
            routes[k] = RandomTours.shuffled(matrix.size(), random);
        }
        return evaluate(matrix, routes);
    }

    static Population evaluate(DistanceMatrix matrix, int[][] routes) {
        double[] costs = new double[routes.length];
        for (int k = 0; k < routes.length; k++) {
            costs[k] = TourCost.length(matrix, routes[k]);
        }
        return new Population(routes, costs);
    }

    int[] route(int index) {
        return routes[index];
    }

    double cost(int index) {
        return costs[index];
    }

    double[] costs() {
        return costs;
    }

    /**
     * Index of the cheapest individual; the first wins ties.
     */
    int bestIndex() {
        int best = 0;
        for (int k = 1; k < costs.length; k++) {
            if (costs[k] < costs[best]) {
                best = k;
            }
        }
        return best;
    }
}
