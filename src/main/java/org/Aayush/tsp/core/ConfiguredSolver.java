package org.Aayush.tsp.core;

import org.Aayush.tsp.search.TourSolver;

import java.util.Map;

/**
 * A bound solver together with the effective parameters it was built from.
 *
 * @param solver ready-to-run heuristic.
 * @param meta effective parameters in canonical order and form.
 */
record ConfiguredSolver(TourSolver solver, Map<String, Object> meta) {
}
