package com.gnovoa.liveops.solver;

import com.gnovoa.liveops.core.SlotClock;
import com.gnovoa.liveops.model.Assignment;
import com.gnovoa.liveops.model.AvailabilityWindow;
import com.gnovoa.liveops.model.Match;
import com.gnovoa.liveops.model.MatchState;
import com.gnovoa.liveops.model.Player;
import com.gnovoa.liveops.model.Schedule;
import com.gnovoa.liveops.model.TournamentConfig;
import com.gnovoa.liveops.model.TournamentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the solver request for a mid-tournament re-solve and folds the answer back into the
 * live tables.
 *
 * <p>Started and finished matches are frozen: sent as locked hints and kept at their exact
 * position when the answer is merged, whatever the solver returned for them.
 */
public final class ReoptimizationPlanner {

    private static final Logger log = LoggerFactory.getLogger(ReoptimizationPlanner.class);

    private final double timeLimitSeconds;
    private final int numWorkers;
    private final int minFreezeHorizonSlots;

    public ReoptimizationPlanner(double timeLimitSeconds, int numWorkers, int minFreezeHorizonSlots) {
        this.timeLimitSeconds = timeLimitSeconds;
        this.numWorkers = numWorkers;
        this.minFreezeHorizonSlots = minFreezeHorizonSlots;
    }

    public SolveRequest buildRequest(TournamentState state, int currentSlot) {
        TournamentConfig config = state.config();
        SlotClock slotClock = new SlotClock(config);

        List<SolveRequest.PreviousAssignment> hints = new ArrayList<>();
        for (Assignment a : state.assignments()) {
            MatchState s = state.stateOf(a.matchId());
            if (s.status().isCommitted()) {
                hints.add(new SolveRequest.PreviousAssignment(a.matchId(), a.slotId(), a.courtId(), true, null, null));
            } else if (s.pinned()) {
                hints.add(new SolveRequest.PreviousAssignment(
                        a.matchId(), a.slotId(), a.courtId(), false, a.slotId(), a.courtId()));
            }
        }

        return new SolveRequest(
                new SolveRequest.Config(
                        slotClock.totalSlots(),
                        config.courtCount(),
                        config.intervalMinutes(),
                        slotClock.minutesToSlots(config.defaultRestMinutes()),
                        Math.max(config.freezeHorizonSlots(), minFreezeHorizonSlots),
                        currentSlot),
                state.players().stream().map(p -> playerInput(p, config, slotClock)).toList(),
                state.matches().stream().map(ReoptimizationPlanner::matchInput).toList(),
                hints,
                new SolveRequest.Options(timeLimitSeconds, numWorkers)
        );
    }

    /**
     * Returns the state after applying the solver's schedule. Frozen matches are evaluated
     * against {@code current}, the snapshot at apply time, not the one the request was built from.
     */
    public TournamentState merge(TournamentState current, Schedule solved) {
        Map<String, Assignment> frozen = new LinkedHashMap<>();
        for (Assignment a : current.assignments()) {
            if (current.stateOf(a.matchId()).status().isCommitted()) frozen.put(a.matchId(), a);
        }

        List<Assignment> merged = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Assignment a : solved.assignments()) {
            if (!seen.add(a.matchId())) continue;
            Assignment keep = frozen.get(a.matchId());
            if (keep != null) {
                if (keep.courtId() != a.courtId() || keep.slotId() != a.slotId()) {
                    log.warn("Solver moved frozen match {} from court {} slot {} to court {} slot {}; keeping it in place",
                            a.matchId(), keep.courtId(), keep.slotId(), a.courtId(), a.slotId());
                }
                merged.add(keep);
            } else {
                merged.add(a);
            }
        }
        for (Assignment keep : frozen.values()) {
            if (!seen.contains(keep.matchId())) {
                log.warn("Solver omitted frozen match {}; keeping it on court {} slot {}",
                        keep.matchId(), keep.courtId(), keep.slotId());
                merged.add(keep);
            }
        }

        Map<String, MatchState> states = new LinkedHashMap<>(current.matchStates());
        for (MatchState s : current.matchStates().values()) {
            if (s.hasOriginalPosition() && !frozen.containsKey(s.matchId())) {
                states.put(s.matchId(), s.toBuilder().clearOriginalPosition().build());
            }
        }

        return current.withSchedule(solved.withAssignments(merged)).withMatchStates(states);
    }

    private static SolveRequest.PlayerInput playerInput(Player p, TournamentConfig config, SlotClock slotClock) {
        List<List<Integer>> windows = new ArrayList<>();
        for (AvailabilityWindow w : p.availability()) {
            int start = Math.max(0, slotClock.timeToSlot(w.start()));
            int end = Math.min(slotClock.totalSlots(), slotClock.timeToSlot(w.end()));
            if (end > start) windows.add(List.of(start, end));
        }
        return new SolveRequest.PlayerInput(p.id(), p.name(), windows, slotClock.minutesToSlots(p.restMinutes(config)));
    }

    private static SolveRequest.MatchInput matchInput(Match m) {
        return new SolveRequest.MatchInput(m.id(), m.label(), m.durationSlots(), m.sideA(), m.sideB());
    }
}
