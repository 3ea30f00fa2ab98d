package com.gnovoa.liveops.core;

import com.gnovoa.liveops.model.MatchState;
import com.gnovoa.liveops.model.MatchStatePatch;
import com.gnovoa.liveops.model.MatchStatus;
import com.gnovoa.liveops.model.TournamentState;

import java.time.Clock;
import java.util.Map;

/**
 * Validates and applies match status transitions.
 *
 * <p>Every method computes the next {@link MatchState} from a snapshot and returns it; committing
 * it is the caller's job. Timestamps are owned here: entering {@code started} stamps
 * {@code actualStartTime} when absent, entering {@code finished} stamps {@code actualEndTime}.
 * Moving backward clears what the undone step produced.
 */
public final class MatchLifecycle {

    private final Clock clock;

    public MatchLifecycle(Clock clock) {
        this.clock = clock;
    }

    /**
     * Moves the match to {@code newStatus}.
     *
     * @throws InvalidTransitionException when {@code newStatus} is not a valid next status
     * @throws NotFoundException when the match does not exist
     */
    public MatchState transition(TournamentState state, String matchId, MatchStatus newStatus, MatchStatePatch patch) {
        requireMatch(state, matchId);
        MatchState current = state.stateOf(matchId);
        MatchStatus from = current.status();
        if (!from.canMoveTo(newStatus)) {
            throw new InvalidTransitionException(matchId, from, newStatus);
        }

        MatchState.Builder b = current.toBuilder().status(newStatus);
        if (from != newStatus && from.undoTarget().filter(newStatus::equals).isPresent()) {
            clearUndone(from, b);
        }
        if (patch != null) patch.applyTo(b);
        if (from == MatchStatus.CALLED && newStatus != MatchStatus.CALLED) {
            b.playerConfirmations(Map.of());
        }
        return stamp(b.updatedAt(clock.instant()).build());
    }

    /**
     * Reverts the match one step along its undo path.
     *
     * @throws InvalidTransitionException when the match is {@code scheduled}
     */
    public MatchState undo(TournamentState state, String matchId) {
        requireMatch(state, matchId);
        MatchState current = state.stateOf(matchId);
        MatchStatus target = current.status().undoTarget()
                .orElseThrow(() -> new InvalidTransitionException(matchId, current.status()));

        MatchState.Builder b = current.toBuilder().status(target);
        clearUndone(current.status(), b);
        if (current.status() == MatchStatus.CALLED) {
            b.playerConfirmations(Map.of());
        }
        return b.updatedAt(clock.instant()).build();
    }

    /** Applies side-channel fields without touching the status. */
    public MatchState patch(TournamentState state, String matchId, MatchStatePatch patch) {
        requireMatch(state, matchId);
        MatchState.Builder b = state.stateOf(matchId).toBuilder();
        if (patch != null) patch.applyTo(b);
        return b.updatedAt(clock.instant()).build();
    }

    private MatchState stamp(MatchState s) {
        if (s.status() == MatchStatus.STARTED && s.actualStartTime() == null) {
            return s.toBuilder().actualStartTime(SlotClock.now(clock)).build();
        }
        if (s.status() == MatchStatus.FINISHED && s.actualEndTime() == null) {
            return s.toBuilder().actualEndTime(SlotClock.now(clock)).build();
        }
        return s;
    }

    private static void clearUndone(MatchStatus from, MatchState.Builder b) {
        switch (from) {
            case STARTED -> b.actualStartTime(null);
            case FINISHED -> b.actualEndTime(null).score(null);
            default -> { }
        }
    }

    private static void requireMatch(TournamentState state, String matchId) {
        if (state.match(matchId).isEmpty()) throw NotFoundException.match(matchId);
    }
}
