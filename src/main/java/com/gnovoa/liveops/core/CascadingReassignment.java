package com.gnovoa.liveops.core;

import com.gnovoa.liveops.model.Assignment;
import com.gnovoa.liveops.model.MatchState;
import com.gnovoa.liveops.model.MatchStatus;
import com.gnovoa.liveops.model.TournamentState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Moves a match onto an operator-chosen court and pushes whatever it collides with forward in
 * time, recording each moved match's original position so the move can be undone.
 *
 * <p>The ripple is driven by an explicit stack of blocks to clear. The block on top is rescanned
 * until nothing displaceable overlaps it; each displaced match lands at the end of the block and
 * its new interval is pushed as the next block. A match is displaced at most once, and a
 * displaced match never lands on top of an already placed one, so the work is bounded by the
 * number of matches on the court.
 *
 * <p>Started, finished and pinned matches are never moved. Pinned matches are also ignored when
 * computing the first free slot on the target court.
 */
public final class CascadingReassignment {

    private static final Comparator<Assignment> EARLIEST_FIRST =
            Comparator.comparingInt(Assignment::slotId).thenComparing(Assignment::matchId);

    /** Half-open slot interval on the target court that must be free of displaceable matches. */
    public record Block(int from, int to) {
        public static Block of(Assignment a) {
            return new Block(a.slotId(), a.endSlot());
        }
    }

    /**
     * Computes the table after starting {@code matchId} on {@code targetCourt}. Nothing is
     * committed; the caller applies the returned table before transitioning the match.
     */
    public CascadeResult startOnCourt(TournamentState state, String matchId, int targetCourt) {
        Assignment current = state.assignment(matchId).orElseThrow(() -> NotFoundException.assignment(matchId));

        Map<String, Assignment> working = new LinkedHashMap<>();
        state.assignments().forEach(a -> working.put(a.matchId(), a));
        Map<String, MatchState> stashed = new LinkedHashMap<>();

        int start = nextAvailableSlot(state, targetCourt);
        stashOriginal(state, stashed, current);
        Assignment placed = current.movedTo(targetCourt, start);
        working.put(matchId, placed);

        Set<String> processed = new HashSet<>();
        processed.add(matchId);
        Deque<Block> worklist = new ArrayDeque<>();
        worklist.push(Block.of(placed));

        List<Assignment> moved = new ArrayList<>();
        moved.add(placed);
        moved.addAll(drain(state, targetCourt, working, worklist, processed, stashed));

        return new CascadeResult(matchId, table(state, working), moved, stashed);
    }

    /**
     * Reverses the last start-on-court of {@code matchId}: the match goes back to its recorded
     * original position, and every other not-yet-started match whose original position lies on
     * the court the match was moved to goes back to its own. Returns empty when nothing was
     * recorded.
     */
    public Optional<CascadeResult> undoStart(TournamentState state, String matchId) {
        MatchState initiator = state.stateOf(matchId);
        if (!initiator.hasOriginalPosition()) return Optional.empty();
        Assignment current = state.assignment(matchId).orElseThrow(() -> NotFoundException.assignment(matchId));
        int court = current.courtId();

        Map<String, Assignment> working = new LinkedHashMap<>();
        state.assignments().forEach(a -> working.put(a.matchId(), a));
        Map<String, MatchState> cleared = new LinkedHashMap<>();
        List<Assignment> restored = new ArrayList<>();

        Assignment back = current.movedTo(initiator.originalCourtId(), initiator.originalSlotId());
        working.put(matchId, back);
        restored.add(back);
        cleared.put(matchId, initiator.toBuilder().clearOriginalPosition().build());

        for (Assignment a : state.assignments()) {
            if (a.matchId().equals(matchId)) continue;
            MatchState s = state.stateOf(a.matchId());
            if (!s.hasOriginalPosition() || s.originalCourtId() != court) continue;
            if (s.status().isCommitted()) continue;

            Assignment original = a.movedTo(s.originalCourtId(), s.originalSlotId());
            working.put(a.matchId(), original);
            restored.add(original);
            cleared.put(a.matchId(), s.toBuilder().clearOriginalPosition().build());
        }

        return Optional.of(new CascadeResult(matchId, table(state, working), restored, cleared));
    }

    /**
     * First slot on {@code courtId} after all committed work: the latest end of a started or
     * finished, non-pinned assignment there, or 0.
     */
    public int nextAvailableSlot(TournamentState state, int courtId) {
        int next = 0;
        for (Assignment a : state.assignmentsOnCourt(courtId)) {
            MatchState s = state.stateOf(a.matchId());
            if (s.pinned() || !s.status().isCommitted()) continue;
            next = Math.max(next, a.endSlot());
        }
        return next;
    }

    /** Id of a started match occupying {@code courtId}, other than {@code exceptMatchId}. */
    public Optional<String> startedMatchOn(TournamentState state, int courtId, String exceptMatchId) {
        for (Assignment a : state.assignments()) {
            if (a.matchId().equals(exceptMatchId)) continue;
            MatchState s = state.stateOf(a.matchId());
            if (s.status() != MatchStatus.STARTED) continue;
            int court = s.actualCourtId() != null ? s.actualCourtId() : a.courtId();
            if (court == courtId) return Optional.of(a.matchId());
        }
        return Optional.empty();
    }

    /**
     * Clears every block on the worklist, displacing overlapping matches on {@code courtId}.
     *
     * @return the displaced assignments at their new positions, in displacement order
     */
    List<Assignment> drain(
            TournamentState state,
            int courtId,
            Map<String, Assignment> working,
            Deque<Block> worklist,
            Set<String> processed,
            Map<String, MatchState> stashed
    ) {
        List<Assignment> displaced = new ArrayList<>();
        while (!worklist.isEmpty()) {
            Block block = worklist.peek();
            Optional<Assignment> victim = working.values().stream()
                    .filter(a -> a.courtId() == courtId)
                    .filter(a -> !processed.contains(a.matchId()))
                    .filter(a -> isDisplaceable(state, a.matchId()))
                    .filter(a -> a.overlaps(block.from(), block.to()))
                    .min(EARLIEST_FIRST);
            if (victim.isEmpty()) {
                worklist.pop();
                continue;
            }

            Assignment a = victim.get();
            stashOriginal(state, stashed, a);
            int slot = landingSlot(working, processed, courtId, block.to(), a.durationSlots());
            Assignment pushed = a.movedTo(courtId, slot);
            working.put(a.matchId(), pushed);
            processed.add(a.matchId());
            displaced.add(pushed);
            worklist.push(Block.of(pushed));
        }
        return displaced;
    }

    /** Earliest slot at or after {@code from} where the match does not overlap an already placed one. */
    private static int landingSlot(Map<String, Assignment> working, Set<String> placed, int courtId, int from, int duration) {
        int slot = from;
        boolean moved = true;
        while (moved) {
            moved = false;
            for (String id : placed) {
                Assignment p = working.get(id);
                if (p.courtId() == courtId && p.overlaps(slot, slot + duration)) {
                    slot = p.endSlot();
                    moved = true;
                }
            }
        }
        return slot;
    }

    private static boolean isDisplaceable(TournamentState state, String matchId) {
        MatchState s = state.stateOf(matchId);
        return !s.pinned() && !s.status().isCommitted();
    }

    /** Records the pre-move position unless one is already recorded. */
    private static void stashOriginal(TournamentState state, Map<String, MatchState> stashed, Assignment preMove) {
        MatchState s = stashed.getOrDefault(preMove.matchId(), state.stateOf(preMove.matchId()));
        if (s.hasOriginalPosition()) return;
        stashed.put(preMove.matchId(), s.toBuilder().originalPosition(preMove.slotId(), preMove.courtId()).build());
    }

    private static List<Assignment> table(TournamentState state, Map<String, Assignment> working) {
        return state.assignments().stream().map(a -> working.get(a.matchId())).toList();
    }
}
