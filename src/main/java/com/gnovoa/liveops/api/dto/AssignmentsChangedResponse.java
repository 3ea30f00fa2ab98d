package com.gnovoa.liveops.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gnovoa.liveops.model.Assignment;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssignmentsChangedResponse(
        String matchId,
        List<Assignment> movedAssignments,
        List<Assignment> restoredAssignments
) {
    public static AssignmentsChangedResponse moved(String matchId, List<Assignment> moved) {
        return new AssignmentsChangedResponse(matchId, moved, null);
    }

    public static AssignmentsChangedResponse restored(String matchId, List<Assignment> restored) {
        return new AssignmentsChangedResponse(matchId, null, restored);
    }
}
