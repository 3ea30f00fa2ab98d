package com.gnovoa.liveops.solver;

/**
 * External schedule optimizer. Implementations block for up to the request's time limit and
 * throw {@link com.gnovoa.liveops.core.SolverFailureException} when the call itself fails.
 */
public interface ScheduleSolver {

    SolveResponse solve(SolveRequest request);
}
