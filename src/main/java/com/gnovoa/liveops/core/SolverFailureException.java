package com.gnovoa.liveops.core;

import com.gnovoa.liveops.model.SolverStatus;

import java.util.List;

/**
 * The solver call failed, timed out or returned a status that cannot replace the live schedule.
 */
public class SolverFailureException extends LiveOpsException {

    private final SolverStatus status;
    private final List<String> infeasibleReasons;

    public SolverFailureException(String message, Throwable cause) {
        super("solver_failure", message, cause);
        this.status = null;
        this.infeasibleReasons = List.of();
    }

    public SolverFailureException(SolverStatus status, List<String> infeasibleReasons) {
        super(status == SolverStatus.INFEASIBLE || status == SolverStatus.MODEL_INVALID
                        ? "solver_infeasible" : "solver_failure",
                "Solver returned status '" + (status == null ? "unknown" : status.name().toLowerCase()) + "'");
        this.status = status;
        this.infeasibleReasons = infeasibleReasons == null ? List.of() : List.copyOf(infeasibleReasons);
    }

    /** Solver status, or null when the call itself failed. */
    public SolverStatus status() {
        return status;
    }

    public List<String> infeasibleReasons() {
        return infeasibleReasons;
    }

    @Override
    public List<String> details() {
        return infeasibleReasons;
    }
}
