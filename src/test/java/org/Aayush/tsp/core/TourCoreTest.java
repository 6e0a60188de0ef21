package org.Aayush.tsp.core;

import org.Aayush.tsp.config.ParameterMap;
import org.Aayush.tsp.cost.DistanceMatrix;
import org.Aayush.tsp.cost.TourCost;
import org.Aayush.tsp.cost.TourValidator;
import org.Aayush.tsp.move.MoveGenerator;
import org.Aayush.tsp.search.SearchOutcome;
import org.Aayush.tsp.testutil.TspFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TourCore Tests")
class TourCoreTest {
    private static final Map<SolverAlgorithm, Map<String, Object>> SMALL_BUDGETS = Map.of(
            SolverAlgorithm.HILL_CLIMBING, Map.of("n_starts", 3),
            SolverAlgorithm.SIMULATED_ANNEALING, Map.of("max_iter", 2_000),
            SolverAlgorithm.TABU_SEARCH, Map.of("max_iter", 300),
            SolverAlgorithm.GRASP, Map.of("iterations", 5),
            SolverAlgorithm.GENETIC_ALGORITHM, Map.of("population_size", 20, "generations", 20),
            SolverAlgorithm.NEAREST_NEIGHBOR, Map.of()
    );

    private final TourCore core = new TourCore();

    @Nested
    @DisplayName("Solving")
    class Solving {

        @ParameterizedTest(name = "{0}")
        @EnumSource(SolverAlgorithm.class)
        @DisplayName("Every algorithm returns a valid route with a recomputed cost and echoed meta")
        void testEveryAlgorithm(SolverAlgorithm algorithm) {
            DistanceMatrix matrix = TspFixtureFactory.euclidean(25, 31L);
            SolveResponse response = core.solve(SolveRequest.builder()
                    .distanceMatrix(matrix)
                    .algorithm(algorithm)
                    .parameters(SMALL_BUDGETS.get(algorithm))
                    .seed(5L)
                    .build());

            assertTrue(TourValidator.isPermutation(response.getRoute(), 25));
            assertEquals(TourCost.length(matrix, response.getRoute()), response.getCost());
            assertEquals(algorithm, response.getAlgorithm());
            assertTrue(response.getRuntimeSeconds() >= 0.0d);
            assertTrue(response.getMeta().keySet().containsAll(SMALL_BUDGETS.get(algorithm).keySet()));
        }

        @Test
        @DisplayName("Nearest neighbor on the five-city example")
        void testFiveCityNearestNeighbor() {
            SolveResponse response = core.solve(SolveRequest.builder()
                    .distanceMatrix(TspFixtureFactory.fiveCity())
                    .algorithm(SolverAlgorithm.NEAREST_NEIGHBOR)
                    .parameter("start_city", 0)
                    .build());

            assertArrayEquals(new int[]{0, 4, 1, 3, 2}, response.getRoute());
            assertEquals(25.0d, response.getCost());
            assertEquals(List.of("start_city", "n_cities", "method"), List.copyOf(response.getMeta().keySet()));
            assertEquals(List.of(0, 5, "nearest_neighbor"), List.copyOf(response.getMeta().values()));
        }

        @Test
        @DisplayName("Equal seeds give equal tours; an explicit generator takes precedence over the seed")
        void testRandomResolution() {
            DistanceMatrix matrix = TspFixtureFactory.euclidean(30, 8L);
            SolveRequest.SolveRequestBuilder base = SolveRequest.builder()
                    .distanceMatrix(matrix)
                    .algorithm(SolverAlgorithm.TABU_SEARCH)
                    .parameter("max_iter", 200);

            SolveResponse seededA = core.solve(base.seed(77L).build());
            SolveResponse seededB = core.solve(base.seed(77L).build());
            SolveResponse explicitA = core.solve(base.seed(1L).random(new Random(77L)).build());
            SolveResponse explicitB = core.solve(base.seed(2L).random(new Random(77L)).build());

            assertArrayEquals(seededA.getRoute(), seededB.getRoute());
            assertArrayEquals(explicitA.getRoute(), explicitB.getRoute());
        }

        @Test
        @DisplayName("Response route is a defensive copy")
        void testRouteCopy() {
            SolveResponse response = core.solve(SolveRequest.builder()
                    .distanceMatrix(TspFixtureFactory.fiveCity())
                    .algorithm(SolverAlgorithm.NEAREST_NEIGHBOR)
                    .build());
            int[] route = response.getRoute();
            route[0] = 99;
            assertNotSame(route, response.getRoute());
            assertEquals(0, response.getRoute()[0]);
        }
    }

    @Nested
    @DisplayName("Cost bookkeeping")
    class CostBookkeeping {

        @ParameterizedTest(name = "{0}")
        @EnumSource(value = SolverAlgorithm.class, names = {"TABU_SEARCH", "HILL_CLIMBING", "SIMULATED_ANNEALING", "GRASP"})
        @DisplayName("Delta-tracked searches report the exact cost on a wide-range matrix")
        void testWideRangeMatrix(SolverAlgorithm algorithm) {
            DistanceMatrix matrix = TspFixtureFactory.wideRangeRing(8, 13L);
            for (long seed = 0L; seed < 20L; seed++) {
                SolveRequest.SolveRequestBuilder request = SolveRequest.builder()
                        .distanceMatrix(matrix)
                        .algorithm(algorithm)
                        .seed(seed);
                if (algorithm != SolverAlgorithm.TABU_SEARCH) {
                    request.parameter("use_delta", true);
                }
                SolveResponse response = core.solve(request.build());

                assertTrue(TourValidator.isPermutation(response.getRoute(), 8));
                assertEquals(TourCost.length(matrix, response.getRoute()), response.getCost());
            }
        }

        @Test
        @DisplayName("Tabu search finds the cheap ring once best costs are recomputed")
        void testTabuFindsRing() {
            DistanceMatrix matrix = TspFixtureFactory.wideRangeRing(8, 13L);
            SolveResponse response = core.solve(SolveRequest.builder()
                    .distanceMatrix(matrix)
                    .algorithm(SolverAlgorithm.TABU_SEARCH)
                    .seed(3L)
                    .build());
            assertEquals(8 * 1.1d, response.getCost(), 1e-9d);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Missing request fields have their own reason codes")
        void testMissingFields() {
            assertReason(TourCore.REASON_REQUEST_REQUIRED, null);
            assertReason(TourCore.REASON_DISTANCE_MATRIX_REQUIRED, SolveRequest.builder()
                    .algorithm(SolverAlgorithm.GRASP)
                    .build());
            assertReason(TourCore.REASON_ALGORITHM_REQUIRED, SolveRequest.builder()
                    .distanceMatrix(TspFixtureFactory.fiveCity())
                    .build());
        }

        @Test
        @DisplayName("Configuration failures are wrapped with the component reason code in the message")
        void testConfigurationWrapped() {
            TourCoreException unknown = assertReason(TourCore.REASON_CONFIGURATION_FAILED, SolveRequest.builder()
                    .distanceMatrix(TspFixtureFactory.fiveCity())
                    .algorithm(SolverAlgorithm.HILL_CLIMBING)
                    .parameter("neighbourhood", "swap")
                    .build());
            assertTrue(unknown.getMessage().contains(ParameterMap.REASON_UNKNOWN_PARAMETER));

            TourCoreException tenure = assertReason(TourCore.REASON_CONFIGURATION_FAILED, SolveRequest.builder()
                    .distanceMatrix(TspFixtureFactory.fiveCity())
                    .algorithm(SolverAlgorithm.TABU_SEARCH)
                    .parameter("tabu_tenure", 0)
                    .build());
            assertTrue(tenure.getMessage().contains(ParameterMap.REASON_OUT_OF_RANGE));

            assertReason(TourCore.REASON_CONFIGURATION_FAILED, SolveRequest.builder()
                    .distanceMatrix(TspFixtureFactory.fiveCity())
                    .algorithm(SolverAlgorithm.NEAREST_NEIGHBOR)
                    .parameter("start_city", 5)
                    .build());
        }

        @ParameterizedTest(name = "{0}")
        @EnumSource(value = SolverAlgorithm.class, names = "NEAREST_NEIGHBOR", mode = EnumSource.Mode.EXCLUDE)
        @DisplayName("Move-based algorithms reject instances with fewer than four cities")
        void testTinyInstances(SolverAlgorithm algorithm) {
            TourCoreException ex = assertReason(TourCore.REASON_CONFIGURATION_FAILED, SolveRequest.builder()
                    .distanceMatrix(DistanceMatrix.of(new double[][]{{0, 1, 2}, {1, 0, 3}, {2, 3, 0}}))
                    .algorithm(algorithm)
                    .build());
            assertTrue(ex.getMessage().contains(MoveGenerator.REASON_TOO_FEW_CITIES));
        }

        @Test
        @DisplayName("Corrupted outcomes are rejected as invariant violations")
        void testOutcomeVerification() {
            DistanceMatrix matrix = TspFixtureFactory.fiveCity();
            TourCoreException duplicate = assertThrows(TourCoreException.class,
                    () -> core.verifyOutcome(matrix, new SearchOutcome(new int[]{0, 1, 1, 3, 4}, 10.0d)));
            assertEquals(TourCore.REASON_RESULT_INVARIANT_VIOLATED, duplicate.getReasonCode());

            TourCoreException wrongCost = assertThrows(TourCoreException.class,
                    () -> core.verifyOutcome(matrix, new SearchOutcome(new int[]{0, 4, 1, 3, 2}, 24.0d)));
            assertEquals(TourCore.REASON_RESULT_INVARIANT_VIOLATED, wrongCost.getReasonCode());

            assertEquals(25.0d, core.verifyOutcome(matrix, new SearchOutcome(new int[]{0, 4, 1, 3, 2}, 25.0d)));
        }

        private TourCoreException assertReason(String reason, SolveRequest request) {
            TourCoreException ex = assertThrows(TourCoreException.class, () -> core.solve(request));
            assertEquals(reason, ex.getReasonCode());
            assertTrue(ex.getMessage().startsWith("[" + reason + "] "));
            return ex;
        }
    }

    @Test
    @DisplayName("Algorithm ids resolve case-insensitively")
    void testAlgorithmIds() {
        assertEquals(SolverAlgorithm.TABU_SEARCH, SolverAlgorithm.fromId("TABU"));
        assertEquals(SolverAlgorithm.GENETIC_ALGORITHM, SolverAlgorithm.fromId("genetic_algorithm"));
        assertNull(SolverAlgorithm.fromId("aco"));
    }
}
