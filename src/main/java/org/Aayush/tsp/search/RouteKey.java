package org.Aayush.tsp.search;

import java.util.Arrays;

/**
 * Value-equality wrapper over a route, used as a tabu key.
 */
final class RouteKey {
    private final int[] route;
    private final int hash;

    RouteKey(int[] route) {
        this.route = route;
        this.hash = Arrays.hashCode(route);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RouteKey)) {
            return false;
        }
        RouteKey that = (RouteKey) other;
        return hash == that.hash && Arrays.equals(route, that.route);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return Arrays.toString(route);
    }
}
