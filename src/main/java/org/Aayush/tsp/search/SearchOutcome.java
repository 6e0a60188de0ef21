package org.Aayush.tsp.search;

/**
 * Best tour found by one search.
 *
 * @param route city order, a permutation of {@code 0..n-1}.
 * @param cost closed-tour cost of {@code route}.
 */
public record SearchOutcome(int[] route, double cost) {
}
