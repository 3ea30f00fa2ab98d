package com.gnovoa.liveops.solver;

import com.gnovoa.liveops.model.Assignment;
import com.gnovoa.liveops.model.Schedule;
import com.gnovoa.liveops.model.SoftViolation;
import com.gnovoa.liveops.model.SolverStatus;

import java.util.List;

public record SolveResponse(
        SolverStatus status,
        Double objectiveScore,
        double runtimeMs,
        List<AssignmentResult> assignments,
        List<SoftViolation> softViolations,
        List<String> infeasibleReasons,
        List<String> unscheduledMatches,
        int movedCount,
        int lockedCount
) {

    public SolveResponse {
        if (status == null) status = SolverStatus.UNKNOWN;
        assignments = assignments == null ? List.of() : List.copyOf(assignments);
        softViolations = softViolations == null ? List.of() : List.copyOf(softViolations);
        infeasibleReasons = infeasibleReasons == null ? List.of() : List.copyOf(infeasibleReasons);
        unscheduledMatches = unscheduledMatches == null ? List.of() : List.copyOf(unscheduledMatches);
    }

    public record AssignmentResult(
            String matchId,
            int slotId,
            int courtId,
            int durationSlots,
            boolean moved,
            Integer previousSlotId,
            Integer previousCourtId
    ) {
        public Assignment toAssignment() {
            return new Assignment(matchId, courtId, slotId, durationSlots);
        }
    }

    public Schedule toSchedule() {
        return new Schedule(
                status,
                assignments.stream().map(AssignmentResult::toAssignment).toList(),
                softViolations,
                infeasibleReasons,
                unscheduledMatches,
                objectiveScore
        );
    }
}
