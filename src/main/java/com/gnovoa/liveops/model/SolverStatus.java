package com.gnovoa.liveops.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SolverStatus {
    @JsonProperty("optimal") OPTIMAL,
    @JsonProperty("feasible") FEASIBLE,
    @JsonProperty("infeasible") INFEASIBLE,
    @JsonProperty("unknown") UNKNOWN,
    @JsonProperty("model_invalid") MODEL_INVALID;

    /** Only optimal and feasible results may replace the live Assignment table. */
    public boolean isActionable() {
        return this == OPTIMAL || this == FEASIBLE;
    }
}
