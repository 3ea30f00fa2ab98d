package com.gnovoa.liveops.core;

import com.gnovoa.liveops.model.Assignment;
import com.gnovoa.liveops.model.Match;
import com.gnovoa.liveops.model.MatchState;
import com.gnovoa.liveops.model.MatchStatus;
import com.gnovoa.liveops.model.TournamentState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes the traffic light of scheduled matches from player activity and rest rules.
 *
 * <ul>
 *   <li><b>Red</b>: a player holds a started match elsewhere (or a called one, when
 *       {@code calledBlocks} is set).</li>
 *   <li><b>Yellow</b>: nobody is blocked, but a player has not yet rested the required time since
 *       the end of their most recent finished match (actual end when recorded, scheduled end
 *       otherwise).</li>
 *   <li><b>Green</b>: neither condition holds. A player with no finished match is fully rested.</li>
 * </ul>
 *
 * <p>Evaluation is pure: it reads the snapshot and returns new values, so it can be re-run on
 * every timer tick.
 */
public final class ConflictEvaluator {

    private final boolean calledBlocks;

    /**
     * @param calledBlocks treat players of {@code called} matches as unavailable, not only
     *                     players of {@code started} ones
     */
    public ConflictEvaluator(boolean calledBlocks) {
        this.calledBlocks = calledBlocks;
    }

    /** Verdicts for every assigned match that is still {@code scheduled}, in assignment order. */
    public Map<String, TrafficLightResult> evaluateConflicts(TournamentState state, int currentSlot) {
        PlayerActivity activity = new PlayerActivity(state);
        Map<String, TrafficLightResult> results = new LinkedHashMap<>();
        for (Assignment a : state.assignments()) {
            if (state.statusOf(a.matchId()) != MatchStatus.SCHEDULED) continue;
            results.put(a.matchId(), evaluate(state, activity, a.matchId(), currentSlot));
        }
        return results;
    }

    /** Verdict for a single match; called/started/finished matches are green. */
    public TrafficLightResult evaluate(TournamentState state, String matchId, int currentSlot) {
        MatchStatus status = state.statusOf(matchId);
        if (status == MatchStatus.CALLED) return TrafficLightResult.green("Already called");
        if (status.isCommitted()) return TrafficLightResult.green(null);
        return evaluate(state, new PlayerActivity(state), matchId, currentSlot);
    }

    public List<PlayerStatus> playerStatuses(TournamentState state, String matchId, int currentSlot) {
        return playerStatuses(state, new PlayerActivity(state), matchId, currentSlot);
    }

    private TrafficLightResult evaluate(TournamentState state, PlayerActivity activity, String matchId, int currentSlot) {
        List<PlayerStatus> statuses = playerStatuses(state, activity, matchId, currentSlot);

        List<PlayerStatus> active = statuses.stream()
                .filter(p -> p.availability() == PlayerStatus.Availability.ACTIVE).toList();
        if (!active.isEmpty()) {
            String reason = active.size() == 1
                    ? active.get(0).playerName() + " is " + active.get(0).reason()
                    : String.join("; ", active.stream().map(p -> p.playerName() + ": " + p.reason()).toList());
            return new TrafficLightResult(
                    TrafficLight.RED,
                    reason,
                    active.stream().map(PlayerStatus::matchId).distinct().toList(),
                    active.stream().map(PlayerStatus::playerName).toList(),
                    null,
                    null
            );
        }

        List<PlayerStatus> resting = statuses.stream()
                .filter(p -> p.availability() == PlayerStatus.Availability.RESTING).toList();
        if (!resting.isEmpty()) {
            int latest = resting.stream().mapToInt(PlayerStatus::availableAtSlot).max().orElse(currentSlot);
            int remaining = latest - currentSlot;
            String reason = resting.size() == 1
                    ? resting.get(0).playerName() + " is " + resting.get(0).reason()
                    : String.join(" & ", resting.stream().map(PlayerStatus::playerName).toList())
                            + " are resting (" + slots(remaining) + ")";
            return new TrafficLightResult(
                    TrafficLight.YELLOW,
                    reason,
                    null,
                    null,
                    resting.stream().map(PlayerStatus::playerName).toList(),
                    remaining
            );
        }

        return TrafficLightResult.green("Ready to call");
    }

    private List<PlayerStatus> playerStatuses(TournamentState state, PlayerActivity activity, String matchId, int currentSlot) {
        Optional<Match> match = state.match(matchId);
        if (match.isEmpty()) return List.of();

        SlotClock slotClock = new SlotClock(state.config());
        List<PlayerStatus> out = new ArrayList<>();
        for (String playerId : match.get().playerIds()) {
            String name = state.playerName(playerId);

            Optional<Match> busy = activity.activeMatch(playerId, matchId);
            if (busy.isPresent()) {
                Match other = busy.get();
                MatchStatus otherStatus = state.statusOf(other.id());
                String verb = otherStatus == MatchStatus.CALLED ? "Called to " : "Playing ";
                out.add(new PlayerStatus(
                        playerId, name, PlayerStatus.Availability.ACTIVE,
                        verb + other.label() + courtSuffix(state, other.id()),
                        other.id(), null));
                continue;
            }

            Optional<FinishedMatch> last = activity.lastFinished(playerId, matchId);
            if (last.isPresent()) {
                int restSlots = slotClock.minutesToSlots(restMinutes(state, playerId));
                int availableAt = last.get().endSlot() + restSlots;
                if (currentSlot < availableAt) {
                    int remaining = availableAt - currentSlot;
                    out.add(new PlayerStatus(
                            playerId, name, PlayerStatus.Availability.RESTING,
                            "Resting after " + state.matchLabel(last.get().matchId())
                                    + " (" + slots(remaining) + " remaining, "
                                    + slotClock.slotsToMinutes(remaining) + " min)",
                            last.get().matchId(), availableAt));
                    continue;
                }
            }

            out.add(new PlayerStatus(playerId, name, PlayerStatus.Availability.AVAILABLE, null, null, null));
        }
        return out;
    }

    private static int restMinutes(TournamentState state, String playerId) {
        return state.player(playerId)
                .map(p -> p.restMinutes(state.config()))
                .orElse(state.config().defaultRestMinutes());
    }

    private static String courtSuffix(TournamentState state, String matchId) {
        MatchState s = state.stateOf(matchId);
        Integer court = s.actualCourtId() != null
                ? s.actualCourtId()
                : state.assignment(matchId).map(Assignment::courtId).orElse(null);
        return court == null ? "" : " on court " + court;
    }

    private static String slots(int n) {
        return n + (n == 1 ? " slot" : " slots");
    }

    private record FinishedMatch(String matchId, int endSlot) {}

    /** Per-snapshot index of who is on court and when each player last finished. */
    private final class PlayerActivity {

        private final Map<String, List<Match>> activeByPlayer = new HashMap<>();
        private final Map<String, List<FinishedMatch>> finishedByPlayer = new HashMap<>();

        PlayerActivity(TournamentState state) {
            SlotClock slotClock = new SlotClock(state.config());
            for (Match m : state.matches()) {
                MatchState s = state.stateOf(m.id());
                boolean blocks = s.status() == MatchStatus.STARTED
                        || (calledBlocks && s.status() == MatchStatus.CALLED);
                if (blocks) {
                    for (String p : m.playerIds()) activeByPlayer.computeIfAbsent(p, k -> new ArrayList<>()).add(m);
                }
                if (s.status() == MatchStatus.FINISHED) {
                    Optional<Assignment> a = state.assignment(m.id());
                    if (a.isEmpty()) continue;
                    int end = s.actualEndTime() != null ? slotClock.timeToSlot(s.actualEndTime()) : a.get().endSlot();
                    FinishedMatch f = new FinishedMatch(m.id(), end);
                    for (String p : m.playerIds()) finishedByPlayer.computeIfAbsent(p, k -> new ArrayList<>()).add(f);
                }
            }
        }

        Optional<Match> activeMatch(String playerId, String excludeMatchId) {
            return activeByPlayer.getOrDefault(playerId, List.of()).stream()
                    .filter(m -> !m.id().equals(excludeMatchId))
                    .findFirst();
        }

        Optional<FinishedMatch> lastFinished(String playerId, String excludeMatchId) {
            FinishedMatch best = null;
            for (FinishedMatch f : finishedByPlayer.getOrDefault(playerId, List.of())) {
                if (f.matchId().equals(excludeMatchId)) continue;
                if (best == null || f.endSlot() > best.endSlot()) best = f;
            }
            return Optional.ofNullable(best);
        }
    }
}
