package org.Aayush.tsp.core;

/**
 * Public TSP solve contract.
 *
 * <p>Implementations validate the request before any search starts and throw reason-coded runtime
 * exceptions for contract failures.</p>
 */
public interface SolverService {
    /**
     * Runs one heuristic to completion on one instance.
     *
     * @param request solve request.
     * @return best tour found with its cost, runtime and configuration echo.
     */
    SolveResponse solve(SolveRequest request);
}
