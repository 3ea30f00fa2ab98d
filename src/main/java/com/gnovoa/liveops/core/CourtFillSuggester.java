package com.gnovoa.liveops.core;

import com.gnovoa.liveops.model.Assignment;
import com.gnovoa.liveops.model.Match;
import com.gnovoa.liveops.model.MatchStatus;
import com.gnovoa.liveops.model.TournamentState;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finds idle courts and proposes the earliest green match from another court to fill each.
 * Never moves anything itself.
 */
public final class CourtFillSuggester {

    private static final Comparator<Assignment> EARLIEST_FIRST =
            Comparator.comparingInt(Assignment::slotId).thenComparing(Assignment::matchId);

    public List<FreeCourt> findFreeCourts(TournamentState state, int currentSlot) {
        List<FreeCourt> free = new ArrayList<>();
        for (int courtId = 1; courtId <= state.config().courtCount(); courtId++) {
            List<Assignment> onCourt = state.assignmentsOnCourt(courtId).stream().sorted(EARLIEST_FIRST).toList();

            boolean busy = false;
            boolean called = false;
            Assignment lastFinished = null;
            for (Assignment a : onCourt) {
                MatchStatus s = state.statusOf(a.matchId());
                if (s == MatchStatus.STARTED) busy = true;
                if (s == MatchStatus.CALLED) called = true;
                if (s == MatchStatus.FINISHED) lastFinished = a;
            }
            if (busy || called || lastFinished == null) continue;

            free.add(new FreeCourt(
                    courtId,
                    currentSlot,
                    lastFinished.matchId(),
                    state.matchLabel(lastFinished.matchId()),
                    currentSlot < lastFinished.endSlot()
            ));
        }
        return free;
    }

    /**
     * One suggestion per free court not in {@code skippedCourts}. A match is suggested for at most
     * one court.
     *
     * @param verdicts traffic lights of the same snapshot; only green entries are candidates
     */
    public List<CourtFillSuggestion> suggestCourtFills(
            TournamentState state,
            Map<String, TrafficLightResult> verdicts,
            int currentSlot,
            Set<Integer> skippedCourts
    ) {
        SlotClock slotClock = new SlotClock(state.config());
        Set<String> taken = new HashSet<>();
        List<CourtFillSuggestion> out = new ArrayList<>();

        for (FreeCourt court : findFreeCourts(state, currentSlot)) {
            if (skippedCourts.contains(court.courtId())) continue;

            Optional<Assignment> best = state.assignments().stream()
                    .filter(a -> a.courtId() != court.courtId())
                    .filter(a -> !taken.contains(a.matchId()))
                    .filter(a -> !state.statusOf(a.matchId()).isCommitted())
                    .filter(a -> !state.stateOf(a.matchId()).pinned())
                    .filter(a -> {
                        TrafficLightResult light = verdicts.get(a.matchId());
                        return light != null && light.isGreen();
                    })
                    .min(EARLIEST_FIRST);
            if (best.isEmpty()) continue;

            Assignment a = best.get();
            Optional<Match> match = state.match(a.matchId());
            if (match.isEmpty()) continue;
            taken.add(a.matchId());

            out.add(new CourtFillSuggestion(
                    court.courtId(),
                    a.matchId(),
                    match.get().label(),
                    sideNames(state, match.get().sideA()) + " vs " + sideNames(state, match.get().sideB()),
                    a.courtId(),
                    a.slotId(),
                    slotClock.slotToTime(a.slotId()),
                    court.finishedEarly() ? court.lastMatchLabel() + " finished early" : "Court is available"
            ));
        }
        return out;
    }

    private static String sideNames(TournamentState state, List<String> side) {
        return side.stream().map(state::playerName).collect(Collectors.joining(" & "));
    }
}
