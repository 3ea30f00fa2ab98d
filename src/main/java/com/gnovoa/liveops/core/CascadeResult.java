package com.gnovoa.liveops.core;

import com.gnovoa.liveops.model.Assignment;
import com.gnovoa.liveops.model.MatchState;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a court reassignment or its undo, not yet committed.
 *
 * @param assignments the complete replacement Assignment table
 * @param movedAssignments moved or restored entries, the initiating match first
 * @param updatedStates MatchStates whose original position was stashed or cleared
 */
public record CascadeResult(
        String matchId,
        List<Assignment> assignments,
        List<Assignment> movedAssignments,
        Map<String, MatchState> updatedStates
) {
    public CascadeResult {
        assignments = List.copyOf(assignments);
        movedAssignments = List.copyOf(movedAssignments);
        updatedStates = Map.copyOf(updatedStates);
    }
}
