package org.Aayush.tsp.move;

/**
 * One materialized neighbor of a route.
 *
 * @param move applied move.
 * @param route freshly allocated candidate route (never aliases the source route).
 * @param cost candidate tour cost under the generator's tracking mode.
 * @param delta candidate cost minus source cost.
 */
public record Neighbor(Move move, int[] route, double cost, double delta) {
}
