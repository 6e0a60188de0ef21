package org.Aayush.tsp.genetic;

import org.Aayush.tsp.cost.TourValidator;
import org.Aayush.tsp.search.RandomTours;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Crossover Tests")
class CrossoverTest {

    @Nested
    @DisplayName("Permutation invariant")
    class Invariant {

        @ParameterizedTest(name = "{0}")
        @EnumSource(CrossoverType.class)
        @DisplayName("Random parents always produce a permutation")
        void testRandomParents(CrossoverType type) {
            Crossover crossover = new Crossover(type);
            SplittableRandom random = new SplittableRandom(77L + type.ordinal());
            for (int trial = 0; trial < 5_000; trial++) {
                int n = 2 + random.nextInt(60);
                int[] parent1 = RandomTours.shuffled(n, random);
                int[] parent2 = RandomTours.shuffled(n, random);
                int[] child = crossover.cross(parent1, parent2, random);
                assertTrue(TourValidator.isPermutation(child, n), type + " broke the permutation on n=" + n);
            }
        }

        @ParameterizedTest(name = "{0}")
        @EnumSource(CrossoverType.class)
        @DisplayName("Identical parents produce a permutation; PMX and CX reproduce the parent")
        void testIdenticalParents(CrossoverType type) {
            Crossover crossover = new Crossover(type);
            SplittableRandom random = new SplittableRandom(5L);
            for (int trial = 0; trial < 1_000; trial++) {
                int n = 2 + random.nextInt(40);
                int[] parent = RandomTours.shuffled(n, random);
                int[] child = crossover.cross(parent, parent.clone(), random);
                assertTrue(TourValidator.isPermutation(child, n));
                if (type != CrossoverType.OX) {
                    assertArrayEquals(parent, child);
                }
            }
        }

        @Test
        @DisplayName("Every slice of small parents yields a permutation for OX and PMX")
        void testExhaustiveSlices() {
            SplittableRandom random = new SplittableRandom(9L);
            for (int n = 2; n <= 9; n++) {
                for (int rep = 0; rep < 20; rep++) {
                    int[] parent1 = RandomTours.shuffled(n, random);
                    int[] parent2 = RandomTours.shuffled(n, random);
                    for (int i = 0; i < n; i++) {
                        for (int j = i + 1; j < n; j++) {
                            assertTrue(TourValidator.isPermutation(Crossover.order(parent1, parent2, i, j), n));
                            assertTrue(TourValidator.isPermutation(Crossover.partiallyMapped(parent1, parent2, i, j), n));
                        }
                    }
                }
            }
        }
    }

    @Nested
    @DisplayName("Worked examples")
    class Examples {
        private final int[] parent1 = {0, 1, 2, 3, 4, 5, 6, 7};
        private final int[] parent2 = {3, 7, 5, 1, 6, 0, 2, 4};

        @Test
        @DisplayName("OX keeps the slice and fills from parent 2 starting after the slice")
        void testOrderCrossover() {
            // slice [2,5) = 2,3,4; remaining parent-2 order: 7,5,1,6,0 written at 5,6,7,0,1
            assertArrayEquals(new int[]{6, 0, 2, 3, 4, 7, 5, 1}, Crossover.order(parent1, parent2, 2, 5));
        }

        @Test
        @DisplayName("PMX resolves displaced cities through the slice mapping")
        void testPartiallyMappedCrossover() {
            // slice [2,5) = 2,3,4 from parent 1; parent 2 has 5,1,6 there
            // 5: pos 2 -> p1[2]=2 at p2 index 6 (free) ; 1: pos 3 -> p1[3]=3 at p2 index 0 (free)
            // 6: pos 4 -> p1[4]=4 at p2 index 7 (free)
            assertArrayEquals(new int[]{1, 7, 2, 3, 4, 0, 5, 6}, Crossover.partiallyMapped(parent1, parent2, 2, 5));
        }

        @Test
        @DisplayName("CX copies the cycle through position 0 from parent 1")
        void testCycleCrossover() {
            // cycle: 0 -> p2[0]=3 at p1 index 3 -> p2[3]=1 at index 1 -> p2[1]=7 at index 7 -> p2[7]=4 at 4
            //        -> p2[4]=6 at 6 -> p2[6]=2 at 2 -> p2[2]=5 at 5 -> p2[5]=0 at 0
            assertArrayEquals(parent1, Crossover.cycle(parent1, parent2));

            int[] other = {1, 0, 3, 2, 5, 4, 7, 6};
            // cycle {0,1}: positions 0,1 from parent 1, the rest from parent 2
            assertArrayEquals(new int[]{0, 1, 3, 2, 5, 4, 7, 6}, Crossover.cycle(parent1, other));
        }
    }
}
