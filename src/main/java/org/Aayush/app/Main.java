package org.Aayush.app;

import lombok.extern.log4j.Log4j;
import org.Aayush.tsp.core.SolveRequest;
import org.Aayush.tsp.core.SolveResponse;
import org.Aayush.tsp.core.SolverAlgorithm;
import org.Aayush.tsp.core.TourCore;
import org.Aayush.tsp.cost.DistanceMatrix;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.SplittableRandom;

/**
 * Application entry point used for local smoke runs.
 *
 * <p>Generates a random Euclidean instance and solves it once with each selected algorithm (all by default) using default
 * parameters. Usage: {@code Main [cityCount] [seed] [ihc,sa,tabu,grasp,ga,nn]}.</p>
 */
@Log4j
public class Main {
    static final int DEFAULT_CITY_COUNT = 30;
    static final long DEFAULT_SEED = 42L;

    /**
     * Launches the smoke run.
     *
     * @param args optional city count, seed and comma-separated algorithm ids (default: all).
     */
    public static void main(String[] args) {
        int cityCount = args.length > 0 ? Integer.parseInt(args[0]) : DEFAULT_CITY_COUNT;
        long seed = args.length > 1 ? Long.parseLong(args[1]) : DEFAULT_SEED;
        Set<SolverAlgorithm> algorithms = args.length > 2
                ? parseAlgorithms(args[2])
                : EnumSet.allOf(SolverAlgorithm.class);
        run(cityCount, seed, algorithms);
    }

    /**
     * Parses a comma-separated list of algorithm ids or enum names.
     *
     * @throws IllegalArgumentException on an unknown or empty id.
     */
    static Set<SolverAlgorithm> parseAlgorithms(String raw) {
        Set<SolverAlgorithm> algorithms = EnumSet.noneOf(SolverAlgorithm.class);
        for (String token : raw.split(",")) {
            SolverAlgorithm algorithm = SolverAlgorithm.fromId(token);
            if (algorithm == null) {
                throw new IllegalArgumentException("unknown algorithm '" + token.trim()
                        + "', expected one of ihc, sa, tabu, grasp, ga, nn");
            }
            algorithms.add(algorithm);
        }
        return algorithms;
    }

    /**
     * Solves one generated instance with every algorithm.
     */
    static Map<SolverAlgorithm, SolveResponse> run(int cityCount, long seed) {
        return run(cityCount, seed, EnumSet.allOf(SolverAlgorithm.class));
    }

    /**
     * Solves one generated instance with the selected algorithms.
     *
     * @return responses keyed by algorithm, in declaration order.
     */
    static Map<SolverAlgorithm, SolveResponse> run(int cityCount, long seed, Set<SolverAlgorithm> algorithms) {
        DistanceMatrix matrix = euclideanInstance(cityCount, seed);
        TourCore core = new TourCore();
        Map<SolverAlgorithm, SolveResponse> responses = new EnumMap<>(SolverAlgorithm.class);
        log.info("solving " + cityCount + " random cities (seed " + seed + ")");
        for (SolverAlgorithm algorithm : algorithms) {
            SolveResponse response = core.solve(SolveRequest.builder()
                    .distanceMatrix(matrix)
                    .algorithm(algorithm)
                    .seed(seed)
                    .build());
            responses.put(algorithm, response);
            log.info(String.format(
                    "%-5s cost=%10.3f runtime=%.3fs meta=%s",
                    algorithm.id(),
                    response.getCost(),
                    response.getRuntimeSeconds(),
                    response.getMeta()
            ));
            if (log.isDebugEnabled()) {
                log.debug(algorithm.id() + " route=" + Arrays.toString(response.getRoute()));
            }
        }
        return responses;
    }

    /**
     * Uniform points in the unit square scaled to 1000, with Euclidean distances.
     */
    static DistanceMatrix euclideanInstance(int cityCount, long seed) {
        SplittableRandom random = new SplittableRandom(seed);
        double[] x = new double[cityCount];
        double[] y = new double[cityCount];
        for (int city = 0; city < cityCount; city++) {
            x[city] = random.nextDouble() * 1000.0d;
            y[city] = random.nextDouble() * 1000.0d;
        }
        double[][] rows = new double[cityCount][cityCount];
        for (int i = 0; i < cityCount; i++) {
            for (int j = 0; j < cityCount; j++) {
                rows[i][j] = Math.hypot(x[i] - x[j], y[i] - y[j]);
            }
        }
        return DistanceMatrix.of(rows);
    }
}
