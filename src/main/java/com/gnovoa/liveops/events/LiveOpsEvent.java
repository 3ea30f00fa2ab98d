package com.gnovoa.liveops.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gnovoa.liveops.core.LiveOpsException;
import com.gnovoa.liveops.model.Assignment;
import com.gnovoa.liveops.model.MatchState;

import java.time.Instant;
import java.util.List;

/**
 * Outbound notification of a committed change, or of a re-solve that changed nothing.
 *
 * @param matchState set for {@link LiveOpsEventType#MATCH_STATE_CHANGED}
 * @param assignments changed assignments, or the whole table after a re-solve
 * @param failure set for {@link LiveOpsEventType#REOPTIMIZE_FAILED}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LiveOpsEvent(
        String tournamentId,
        LiveOpsEventType type,
        String matchId,
        Instant occurredAt,
        MatchState matchState,
        List<Assignment> assignments,
        Failure failure
) {

    /** Same shape as the HTTP error body. */
    public record Failure(String code, String message, List<String> details) {}

    public static LiveOpsEvent matchStateChanged(String tournamentId, MatchState state, Instant at) {
        return new LiveOpsEvent(tournamentId, LiveOpsEventType.MATCH_STATE_CHANGED, state.matchId(), at, state, null, null);
    }

    public static LiveOpsEvent scheduleChanged(String tournamentId, String matchId, List<Assignment> changed, Instant at) {
        return new LiveOpsEvent(tournamentId, LiveOpsEventType.SCHEDULE_CHANGED, matchId, at, null, List.copyOf(changed), null);
    }

    public static LiveOpsEvent reoptimized(String tournamentId, List<Assignment> table, Instant at) {
        return new LiveOpsEvent(tournamentId, LiveOpsEventType.REOPTIMIZED, null, at, null, List.copyOf(table), null);
    }

    public static LiveOpsEvent reoptimizeFailed(String tournamentId, LiveOpsException error, Instant at) {
        return new LiveOpsEvent(tournamentId, LiveOpsEventType.REOPTIMIZE_FAILED, null, at, null, null,
                new Failure(error.code(), error.getMessage(), error.details()));
    }
}
