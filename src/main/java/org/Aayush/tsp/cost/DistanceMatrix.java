package org.Aayush.tsp.cost;

import org.Aayush.tsp.config.SolverConfigurationException;

/**
 * Immutable n x n city-to-city travel cost table.
 *
 * <p>Values are stored row-major in one flat array. {@code distance(i, j)} is the cost of travelling
 * directly from city {@code i} to city {@code j}; the table may be asymmetric. Construction copies the
 * caller's rows, so later mutation of the source array has no effect.</p>
 */
public final class DistanceMatrix {
    public static final String REASON_MATRIX_REQUIRED = "TSP_MATRIX_REQUIRED";
    public static final String REASON_MATRIX_EMPTY = "TSP_MATRIX_EMPTY";
    public static final String REASON_MATRIX_NOT_SQUARE = "TSP_MATRIX_NOT_SQUARE";
    public static final String REASON_MATRIX_NON_FINITE = "TSP_MATRIX_NON_FINITE";
    public static final String REASON_MATRIX_NEGATIVE = "TSP_MATRIX_NEGATIVE";

    private final int size;
    private final double[] values;
    private final boolean symmetric;

    private DistanceMatrix(int size, double[] values) {
        this.size = size;
        this.values = values;
        this.symmetric = detectSymmetry(size, values);
    }

    /**
     * Copies and validates a square cost table.
     *
     * @param rows row-major table, {@code rows[i][j]} = cost from city i to city j.
     * @return immutable matrix.
     * @throws SolverConfigurationException when the table is missing, ragged, negative or non-finite.
     */
    public static DistanceMatrix of(double[][] rows) {
        if (rows == null) {
            throw new SolverConfigurationException(REASON_MATRIX_REQUIRED, "distance matrix must be provided");
        }
        int n = rows.length;
        if (n == 0) {
            throw new SolverConfigurationException(REASON_MATRIX_EMPTY, "distance matrix must contain at least one city");
        }
        double[] flat = new double[n * n];
        for (int i = 0; i < n; i++) {
            double[] row = rows[i];
            if (row == null || row.length != n) {
                throw new SolverConfigurationException(
                        REASON_MATRIX_NOT_SQUARE,
                        "row " + i + " must have length " + n + ", got " + (row == null ? "null" : row.length)
                );
            }
            for (int j = 0; j < n; j++) {
                double value = row[j];
                if (!Double.isFinite(value)) {
                    throw new SolverConfigurationException(
                            REASON_MATRIX_NON_FINITE,
                            "distance[" + i + "][" + j + "] must be finite, got " + value
                    );
                }
                if (value < 0.0d) {
                    throw new SolverConfigurationException(
                            REASON_MATRIX_NEGATIVE,
                            "distance[" + i + "][" + j + "] must be >= 0, got " + value
                    );
                }
                flat[i * n + j] = value;
            }
        }
        return new DistanceMatrix(n, flat);
    }

    /**
     * @return number of cities.
     */
    public int size() {
        return size;
    }

    /**
     * Returns the direct travel cost between two cities.
     */
    public double distance(int from, int to) {
        return values[from * size + to];
    }

    /**
     * @return true when {@code distance(i, j) == distance(j, i)} for every pair.
     */
    public boolean isSymmetric() {
        return symmetric;
    }

    private static boolean detectSymmetry(int n, double[] values) {
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (Double.compare(values[i * n + j], values[j * n + i]) != 0) {
                    return false;
                }
            }
        }
        return true;
    }
}
