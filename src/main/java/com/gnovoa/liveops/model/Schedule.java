package com.gnovoa.liveops.model;

import java.util.List;
import java.util.Optional;

/**
 * A timetable produced by the solver. {@code assignments} is the authoritative Assignment
 * table during live operations; one entry per scheduled match.
 */
public record Schedule(
    SolverStatus status,
    List<Assignment> assignments,
    List<SoftViolation> softViolations,
    List<String> infeasibleReasons,
    List<String> unscheduledMatches,
    Double objectiveScore) {

    public Schedule {
        if (status == null) status = SolverStatus.UNKNOWN;
        assignments = assignments == null ? List.of() : List.copyOf(assignments);
        softViolations = softViolations == null ? List.of() : List.copyOf(softViolations);
        infeasibleReasons = infeasibleReasons == null ? List.of() : List.copyOf(infeasibleReasons);
        unscheduledMatches = unscheduledMatches == null ? List.of() : List.copyOf(unscheduledMatches);
    }

    public static Schedule of(List<Assignment> assignments) {
        return new Schedule(SolverStatus.FEASIBLE, assignments, List.of(), List.of(), List.of(), null);
    }

    public Optional<Assignment> assignment(String matchId) {
        return assignments.stream().filter(a -> a.matchId().equals(matchId)).findFirst();
    }

    public Schedule withAssignments(List<Assignment> newAssignments) {
        return new Schedule(status, newAssignments, softViolations, infeasibleReasons, unscheduledMatches, objectiveScore);
    }
}
