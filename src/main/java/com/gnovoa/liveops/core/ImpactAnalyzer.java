package com.gnovoa.liveops.core;

import com.gnovoa.liveops.model.Assignment;
import com.gnovoa.liveops.model.Match;
import com.gnovoa.liveops.model.MatchState;
import com.gnovoa.liveops.model.MatchStatus;
import com.gnovoa.liveops.model.TournamentState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Detects matches that ran past their scheduled end and works out which later matches feel it.
 *
 * <p>Only {@code scheduled} matches can be impacted; anything already called, started or finished
 * is committed and left to the operator.
 */
public final class ImpactAnalyzer {

    /** Assignments whose recorded actual end lies beyond their scheduled end, in table order. */
    public List<Assignment> overrunMatches(TournamentState state) {
        SlotClock slotClock = new SlotClock(state.config());
        List<Assignment> out = new ArrayList<>();
        for (Assignment a : state.assignments()) {
            MatchState s = state.stateOf(a.matchId());
            if (s.actualEndTime() == null) continue;
            if (slotClock.timeToSlot(s.actualEndTime()) > a.endSlot()) out.add(a);
        }
        return out;
    }

    /** Union of the directly impacted matches of every overrun, in table order. */
    public List<Assignment> impactedMatches(TournamentState state) {
        SlotClock slotClock = new SlotClock(state.config());
        Set<String> impacted = new HashSet<>();
        for (Assignment overrun : overrunMatches(state)) {
            int end = slotClock.timeToSlot(state.stateOf(overrun.matchId()).actualEndTime());
            impacted.addAll(sharingPlayers(state, overrun.matchId(), state.playerIdsOf(overrun.matchId()), end));
        }
        return state.assignments().stream().filter(a -> impacted.contains(a.matchId())).toList();
    }

    public ImpactAnalysis analyzeImpact(TournamentState state, String matchId) {
        return analyzeImpact(state, matchId, null);
    }

    /**
     * @param projectedEndSlot end slot to assume instead of the recorded actual end, or null
     * @throws NotFoundException when the match has no assignment
     */
    public ImpactAnalysis analyzeImpact(TournamentState state, String matchId, Integer projectedEndSlot) {
        Assignment assignment = state.assignment(matchId).orElseThrow(() -> NotFoundException.assignment(matchId));
        MatchState s = state.stateOf(matchId);

        int scheduledEnd = assignment.endSlot();
        int actualEnd;
        if (projectedEndSlot != null) {
            actualEnd = projectedEndSlot;
        } else if (s.actualEndTime() != null) {
            actualEnd = new SlotClock(state.config()).timeToSlot(s.actualEndTime());
        } else {
            actualEnd = scheduledEnd;
        }
        int overrun = Math.max(0, actualEnd - scheduledEnd);

        List<String> direct = sharingPlayers(state, matchId, state.playerIdsOf(matchId), actualEnd);

        Set<String> cascade = new LinkedHashSet<>();
        for (String d : direct) {
            int from = state.assignment(d).map(Assignment::slotId).orElse(actualEnd);
            for (String c : sharingPlayers(state, d, state.playerIdsOf(d), from)) {
                if (!c.equals(matchId) && !direct.contains(c)) cascade.add(c);
            }
        }

        return new ImpactAnalysis(
                matchId,
                state.match(matchId).map(Match::matchNumber).orElse(null),
                actualEnd,
                scheduledEnd,
                overrun,
                direct,
                List.copyOf(cascade),
                SuggestedAction.forImpact(overrun, direct.size())
        );
    }

    /** Scheduled matches other than {@code matchId} starting at or after {@code fromSlot} with a player in common. */
    private static List<String> sharingPlayers(TournamentState state, String matchId, Collection<String> players, int fromSlot) {
        List<String> out = new ArrayList<>();
        for (Assignment a : state.assignments()) {
            if (a.matchId().equals(matchId)) continue;
            if (state.statusOf(a.matchId()) != MatchStatus.SCHEDULED) continue;
            if (a.slotId() < fromSlot) continue;
            if (state.playerIdsOf(a.matchId()).stream().anyMatch(players::contains)) out.add(a.matchId());
        }
        return out;
    }
}
