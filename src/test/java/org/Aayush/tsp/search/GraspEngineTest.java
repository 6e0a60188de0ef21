package org.Aayush.tsp.search;

import org.Aayush.tsp.config.SolverConfigurationException;
import org.Aayush.tsp.cost.DistanceMatrix;
import org.Aayush.tsp.cost.TourCost;
import org.Aayush.tsp.cost.TourValidator;
import org.Aayush.tsp.testutil.TspFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("GRASP Tests")
class GraspEngineTest {

    @Nested
    @DisplayName("Greedy randomized construction")
    class Construction {

        @Test
        @DisplayName("alpha = 0 reproduces nearest neighbor from the sampled start city")
        void testAlphaZeroIsNearestNeighbor() {
            DistanceMatrix matrix = TspFixtureFactory.euclidean(25, 5L);
            GreedyRandomizedConstructor constructor = new GreedyRandomizedConstructor(matrix, 0.0d);
            for (long seed = 0; seed < 20; seed++) {
                int[] route = constructor.construct(new SplittableRandom(seed));
                SearchOutcome nn = new NearestNeighborConstructor(NearestNeighborConfig.builder()
                        .startCity(route[0])
                        .build()).solve(matrix, new SplittableRandom(seed));
                assertArrayEquals(nn.route(), route);
            }
        }

        @Test
        @DisplayName("alpha = 1 admits every unvisited city")
        void testAlphaOneIsUniform() {
            DistanceMatrix matrix = TspFixtureFactory.euclidean(5, 9L);
            GreedyRandomizedConstructor constructor = new GreedyRandomizedConstructor(matrix, 1.0d);
            SplittableRandom random = new SplittableRandom(31L);
            Set<String> distinct = new HashSet<>();
            for (int k = 0; k < 5_000; k++) {
                int[] route = constructor.construct(random);
                assertTrue(TourValidator.isPermutation(route, 5));
                distinct.add(Arrays.toString(route));
            }
            assertEquals(120, distinct.size());
        }

        @Test
        @DisplayName("Equal distances are drawn uniformly rather than failing")
        void testDegenerateDistances() {
            double[][] rows = new double[6][6];
            for (int i = 0; i < 6; i++) {
                for (int j = 0; j < 6; j++) {
                    rows[i][j] = i == j ? 0.0d : 4.0d;
                }
            }
            GreedyRandomizedConstructor constructor = new GreedyRandomizedConstructor(DistanceMatrix.of(rows), 0.0d);
            SplittableRandom random = new SplittableRandom(2L);
            Set<Integer> secondCities = new HashSet<>();
            for (int k = 0; k < 500; k++) {
                int[] route = constructor.construct(random);
                assertTrue(TourValidator.isPermutation(route, 6));
                secondCities.add(route[1]);
            }
            assertEquals(6, secondCities.size());
        }

        @Test
        @DisplayName("Rejects alpha outside [0, 1]")
        void testAlphaRange() {
            DistanceMatrix matrix = TspFixtureFactory.euclidean(5, 1L);
            assertThrows(SolverConfigurationException.class, () -> new GreedyRandomizedConstructor(matrix, -0.1d));
            assertThrows(SolverConfigurationException.class, () -> new GreedyRandomizedConstructor(matrix, 1.5d));
        }
    }

    @Test
    @DisplayName("GRASP returns a reproducible, refined tour")
    void testSolve() {
        DistanceMatrix matrix = TspFixtureFactory.euclidean(30, 44L);
        GraspEngine engine = new GraspEngine(GraspConfig.fromMap(Map.of(
                GraspConfig.ITERATIONS, 20,
                GraspConfig.NEIGHBORHOOD_TYPE, "two_opt"
        )));

        SearchOutcome first = engine.solve(matrix, new SplittableRandom(8L));
        SearchOutcome second = engine.solve(matrix, new SplittableRandom(8L));

        assertArrayEquals(first.route(), second.route());
        assertTrue(TourValidator.isPermutation(first.route(), 30));
        assertEquals(TourCost.length(matrix, first.route()), first.cost(), 1e-6 * first.cost());
        SearchOutcome nn = new NearestNeighborConstructor(NearestNeighborConfig.builder().build())
                .solve(matrix, new SplittableRandom(8L));
        assertTrue(first.cost() <= nn.cost() * 1.10d);
    }

    @Test
    @DisplayName("Config echo and validation")
    void testConfig() {
        GraspConfig config = GraspConfig.fromMap(Map.of());
        assertEquals(
                List.of("alpha", "iterations", "neighborhood_type", "ihc_max_iter", "ihc_stop_no_improve", "use_delta"),
                List.copyOf(config.toMeta().keySet())
        );
        assertEquals(List.of(0.3d, 100, "swap", 300, 100, true), List.copyOf(config.toMeta().values()));
        assertThrows(SolverConfigurationException.class, () -> GraspConfig.fromMap(Map.of(GraspConfig.ALPHA, 2.0d)));
    }
}
