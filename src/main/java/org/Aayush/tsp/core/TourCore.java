package org.Aayush.tsp.core;

import lombok.Builder;
import lombok.extern.log4j.Log4j;
import org.Aayush.tsp.config.SolverConfigurationException;
import org.Aayush.tsp.cost.DistanceMatrix;
import org.Aayush.tsp.cost.TourCost;
import org.Aayush.tsp.cost.TourValidator;
import org.Aayush.tsp.search.SearchOutcome;

import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

/**
 * Main solver orchestration entry point.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Validate required request fields.</li>
 * <li>Bind the algorithm and parameters through {@link SolverFactory} before any search starts.</li>
 * <li>Resolve the per-call random stream (explicit generator, else seed, else fresh unseeded).</li>
 * <li>Run the search and time it.</li>
 * <li>Re-validate the returned route as a permutation and recompute its cost from the matrix.</li>
 * <li>Wrap component exceptions into {@link TourCoreException} with stable reason codes.</li>
 * </ul>
 *
 * <p>The facade holds only immutable configuration and is safe for concurrent use as long as callers do
 * not share one {@link RandomGenerator} across threads.</p>
 */
@Log4j
public final class TourCore implements SolverService {
    public static final String REASON_REQUEST_REQUIRED = "TSP_REQUEST_REQUIRED";
    public static final String REASON_DISTANCE_MATRIX_REQUIRED = "TSP_DISTANCE_MATRIX_REQUIRED";
    public static final String REASON_ALGORITHM_REQUIRED = "TSP_ALGORITHM_REQUIRED";
    public static final String REASON_CONFIGURATION_FAILED = "TSP_CONFIGURATION_FAILED";
    public static final String REASON_RESULT_INVARIANT_VIOLATED = "TSP_RESULT_INVARIANT_VIOLATED";

    static final double DEFAULT_RESULT_TOLERANCE = 1e-6d;

    private final double resultTolerance;

    public TourCore() {
        this(null);
    }

    /**
     * @param resultTolerance relative tolerance between the reported and recomputed result cost
     *                        (null selects {@value #DEFAULT_RESULT_TOLERANCE}).
     */
    @Builder
    public TourCore(Double resultTolerance) {
        this.resultTolerance = resultTolerance == null ? DEFAULT_RESULT_TOLERANCE : resultTolerance;
    }

    /**
     * Runs one solve request.
     *
     * @throws TourCoreException when request contracts, configuration or result invariants fail.
     */
    @Override
    public SolveResponse solve(SolveRequest request) {
        if (request == null) {
            throw new TourCoreException(REASON_REQUEST_REQUIRED, "solve request must be provided");
        }
        DistanceMatrix matrix = request.getDistanceMatrix();
        if (matrix == null) {
            throw new TourCoreException(REASON_DISTANCE_MATRIX_REQUIRED, "distanceMatrix must be provided");
        }
        if (request.getAlgorithm() == null) {
            throw new TourCoreException(
                    REASON_ALGORITHM_REQUIRED,
                    "algorithm must be explicitly specified (ihc, sa, tabu, grasp, ga, nn)"
            );
        }

        ConfiguredSolver configured;
        try {
            configured = SolverFactory.create(request.getAlgorithm(), request.getParameters(), matrix.size());
        } catch (SolverConfigurationException ex) {
            throw new TourCoreException(
                    REASON_CONFIGURATION_FAILED,
                    ex.reasonCode() + ": " + ex.getMessage(),
                    ex
            );
        }

        RandomGenerator random = resolveRandom(request);
        if (log.isDebugEnabled()) {
            log.debug("solve start algorithm=" + request.getAlgorithm().id() + " n=" + matrix.size()
                    + " meta=" + configured.meta());
        }

        long startNanos = System.nanoTime();
        SearchOutcome outcome;
        try {
            outcome = configured.solver().solve(matrix, random);
        } catch (SolverConfigurationException ex) {
            throw new TourCoreException(
                    REASON_CONFIGURATION_FAILED,
                    ex.reasonCode() + ": " + ex.getMessage(),
                    ex
            );
        }
        double runtimeSeconds = (System.nanoTime() - startNanos) / 1_000_000_000.0d;

        double cost = verifyOutcome(matrix, outcome);
        if (log.isDebugEnabled()) {
            log.debug("solve finished algorithm=" + request.getAlgorithm().id() + " cost=" + cost
                    + " runtimeSeconds=" + runtimeSeconds);
        }
        return SolveResponse.builder()
                .route(outcome.route().clone())
                .cost(cost)
                .runtimeSeconds(runtimeSeconds)
                .algorithm(request.getAlgorithm())
                .meta(configured.meta())
                .build();
    }

    /**
     * Checks that the outcome is a permutation and that its reported cost matches the matrix.
     *
     * @return recomputed cost.
     */
    double verifyOutcome(DistanceMatrix matrix, SearchOutcome outcome) {
        if (outcome == null || outcome.route() == null) {
            throw new TourCoreException(REASON_RESULT_INVARIANT_VIOLATED, "solver returned no route");
        }
        String defect = TourValidator.describeDefect(outcome.route(), matrix.size());
        if (defect != null) {
            throw new TourCoreException(REASON_RESULT_INVARIANT_VIOLATED, "solver returned an invalid route: " + defect);
        }
        double exact = TourCost.length(matrix, outcome.route());
        if (!TourCost.approximatelyEqual(exact, outcome.cost(), resultTolerance)) {
            throw new TourCoreException(
                    REASON_RESULT_INVARIANT_VIOLATED,
                    "reported cost " + outcome.cost() + " does not match recomputed cost " + exact
            );
        }
        return exact;
    }

    private static RandomGenerator resolveRandom(SolveRequest request) {
        if (request.getRandom() != null) {
            return request.getRandom();
        }
        if (request.getSeed() != null) {
            return new SplittableRandom(request.getSeed());
        }
        return new SplittableRandom();
    }
}
