package org.Aayush.tsp.cost;

import lombok.experimental.UtilityClass;

/**
 * Permutation checks for routes.
 */
@UtilityClass
public final class TourValidator {

    /**
     * Returns true when {@code route} contains every city in {@code [0, cityCount)} exactly once.
     */
    public static boolean isPermutation(int[] route, int cityCount) {
        if (route == null || route.length != cityCount) {
            return false;
        }
        boolean[] seen = new boolean[cityCount];
        for (int city : route) {
            if (city < 0 || city >= cityCount || seen[city]) {
                return false;
            }
            seen[city] = true;
        }
        return true;
    }

    /**
     * Describes the first permutation defect of {@code route}, or returns null when it is valid.
     */
    public static String describeDefect(int[] route, int cityCount) {
        if (route == null) {
            return "route is null";
        }
        if (route.length != cityCount) {
            return "route length " + route.length + " does not match city count " + cityCount;
        }
        boolean[] seen = new boolean[cityCount];
        for (int position = 0; position < route.length; position++) {
            int city = route[position];
            if (city < 0 || city >= cityCount) {
                return "city " + city + " at position " + position + " is out of bounds";
            }
            if (seen[city]) {
                return "city " + city + " is repeated at position " + position;
            }
            seen[city] = true;
        }
        return null;
    }
}
