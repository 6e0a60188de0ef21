package org.Aayush.tsp.core;

import lombok.experimental.UtilityClass;
import org.Aayush.tsp.config.ParameterMap;
import org.Aayush.tsp.config.SolverConfigurationException;
import org.Aayush.tsp.genetic.GeneticAlgorithmConfig;
import org.Aayush.tsp.genetic.GeneticAlgorithmEngine;
import org.Aayush.tsp.move.MoveGenerator;
import org.Aayush.tsp.search.AnnealingConfig;
import org.Aayush.tsp.search.GraspConfig;
import org.Aayush.tsp.search.GraspEngine;
import org.Aayush.tsp.search.HillClimbingConfig;
import org.Aayush.tsp.search.HillClimbingEngine;
import org.Aayush.tsp.search.NearestNeighborConfig;
import org.Aayush.tsp.search.NearestNeighborConstructor;
import org.Aayush.tsp.search.SimulatedAnnealingEngine;
import org.Aayush.tsp.search.TabuSearchConfig;
import org.Aayush.tsp.search.TabuSearchEngine;
import org.Aayush.tsp.search.TourSolver;

import java.util.Collections;
import java.util.Map;

/**
 * Binds an algorithm and its raw parameter map to a ready solver.
 *
 * <p>All parameter and instance-size checks happen here, so a returned solver never fails on
 * configuration once the search loop has started.</p>
 */
@UtilityClass
public final class SolverFactory {
    /**
     * Creates a solver for {@code cityCount} cities.
     *
     * @param algorithm heuristic to bind; the facade has already rejected null.
     * @param parameters raw parameters (null is treated as empty).
     * @param cityCount instance size.
     * @return solver plus its effective-parameter echo.
     * @throws SolverConfigurationException on any unusable parameter or unsupported size.
     */
    static ConfiguredSolver create(SolverAlgorithm algorithm, Map<String, ?> parameters, int cityCount) {
        if (algorithm != SolverAlgorithm.NEAREST_NEIGHBOR) {
            MoveGenerator.requireSupportedSize(cityCount);
        }
        return switch (algorithm) {
            case HILL_CLIMBING -> {
                HillClimbingConfig config = HillClimbingConfig.fromMap(parameters);
                yield bind(new HillClimbingEngine(config), config.toMeta());
            }
            case SIMULATED_ANNEALING -> {
                AnnealingConfig config = AnnealingConfig.fromMap(parameters);
                yield bind(new SimulatedAnnealingEngine(config), config.toMeta());
            }
            case TABU_SEARCH -> {
                TabuSearchConfig config = TabuSearchConfig.fromMap(parameters);
                yield bind(new TabuSearchEngine(config), config.toMeta());
            }
            case GRASP -> {
                GraspConfig config = GraspConfig.fromMap(parameters);
                yield bind(new GraspEngine(config), config.toMeta());
            }
            case GENETIC_ALGORITHM -> {
                GeneticAlgorithmConfig config = GeneticAlgorithmConfig.fromMap(parameters);
                yield bind(new GeneticAlgorithmEngine(config), config.toMeta());
            }
            case NEAREST_NEIGHBOR -> {
                NearestNeighborConfig config = NearestNeighborConfig.fromMap(parameters);
                if (config.getStartCity() >= cityCount) {
                    throw new SolverConfigurationException(
                            ParameterMap.REASON_OUT_OF_RANGE,
                            NearestNeighborConfig.START_CITY + " must be in [0," + (cityCount - 1)
                                    + "], got " + config.getStartCity()
                    );
                }
                yield bind(new NearestNeighborConstructor(config), config.toMeta(cityCount));
            }
        };
    }

    private static ConfiguredSolver bind(TourSolver solver, Map<String, Object> meta) {
        return new ConfiguredSolver(solver, Collections.unmodifiableMap(meta));
    }
}
