package org.Aayush.tsp.genetic;

import lombok.Builder;
import lombok.Value;
import org.Aayush.tsp.config.ParameterMap;
import org.Aayush.tsp.config.SolverConfigurationException;
import org.Aayush.tsp.move.MoveType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Genetic-algorithm parameters.
 */
@Value
@Builder
public class GeneticAlgorithmConfig {
    public static final String POPULATION_SIZE = "population_size";
    public static final String GENERATIONS = "generations";
    public static final String SELECTION = "selection";
    public static final String CROSSOVER = "crossover";
    public static final String MUTATION_TYPE = "mutation_type";
    public static final String MUTATION_PROB = "mutation_prob";
    public static final String TOURNAMENT_SIZE = "tournament_size";

    public static final Set<String> PARAMETER_NAMES = Set.of(
            POPULATION_SIZE, GENERATIONS, SELECTION, CROSSOVER, MUTATION_TYPE, MUTATION_PROB, TOURNAMENT_SIZE
    );

    @Builder.Default
    int populationSize = 80;
    @Builder.Default
    int generations = 300;
    @Builder.Default
    SelectionType selection = SelectionType.TOURNAMENT;
    @Builder.Default
    CrossoverType crossover = CrossoverType.OX;
    /** Operator applied once to a mutated child. */
    @Builder.Default
    MoveType mutationType = MoveType.SWAP;
    /** Per-child mutation probability in [0, 1]. */
    @Builder.Default
    double mutationProb = 0.1d;
    /** Individuals drawn without replacement per tournament. */
    @Builder.Default
    int tournamentSize = 3;

    public static GeneticAlgorithmConfig fromMap(Map<String, ?> raw) {
        ParameterMap params = ParameterMap.of(raw, PARAMETER_NAMES);
        return GeneticAlgorithmConfig.builder()
                .populationSize(params.intValue(POPULATION_SIZE, 80))
                .generations(params.intValue(GENERATIONS, 300))
                .selection(params.optionValue(SELECTION, SelectionType.TOURNAMENT, SelectionType::fromId))
                .crossover(params.optionValue(CROSSOVER, CrossoverType.OX, CrossoverType::fromId))
                .mutationType(params.optionValue(MUTATION_TYPE, MoveType.SWAP, MoveType::fromId))
                .mutationProb(params.doubleValue(MUTATION_PROB, 0.1d))
                .tournamentSize(params.intValue(TOURNAMENT_SIZE, 3))
                .build()
                .validated();
    }

    public GeneticAlgorithmConfig validated() {
        ParameterMap.requireAtLeast(POPULATION_SIZE, populationSize, 2);
        ParameterMap.requireAtLeast(GENERATIONS, generations, 0);
        ParameterMap.requirePresent(SELECTION, selection);
        ParameterMap.requirePresent(CROSSOVER, crossover);
        ParameterMap.requirePresent(MUTATION_TYPE, mutationType);
        ParameterMap.requireClosedRange(MUTATION_PROB, mutationProb, 0.0d, 1.0d);
        ParameterMap.requireAtLeast(TOURNAMENT_SIZE, tournamentSize, 1);
        if (selection == SelectionType.TOURNAMENT && tournamentSize > populationSize) {
            throw new SolverConfigurationException(
                    ParameterMap.REASON_OUT_OF_RANGE,
                    TOURNAMENT_SIZE + " must not exceed " + POPULATION_SIZE
                            + " (" + tournamentSize + " > " + populationSize + ")"
            );
        }
        return this;
    }

    public Map<String, Object> toMeta() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(POPULATION_SIZE, populationSize);
        meta.put(GENERATIONS, generations);
        meta.put(SELECTION, selection.id());
        meta.put(CROSSOVER, crossover.id());
        meta.put(MUTATION_TYPE, mutationType.id());
        meta.put(MUTATION_PROB, mutationProb);
        meta.put(TOURNAMENT_SIZE, tournamentSize);
        return meta;
    }
}
