package com.gnovoa.liveops.runner;

import com.gnovoa.liveops.core.CourtFillSuggestion;
import com.gnovoa.liveops.core.ImpactAnalysis;
import com.gnovoa.liveops.core.PlayerStatus;
import com.gnovoa.liveops.core.TrafficLightResult;
import com.gnovoa.liveops.model.Assignment;
import com.gnovoa.liveops.model.Match;
import com.gnovoa.liveops.model.MatchState;
import com.gnovoa.liveops.model.MatchStatePatch;
import com.gnovoa.liveops.model.MatchStatus;
import com.gnovoa.liveops.model.Schedule;
import com.gnovoa.liveops.model.TournamentDocument;
import com.gnovoa.liveops.model.TournamentState;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Single writer for one tournament. Commands are serialized; reads work on the latest committed
 * snapshot and may run concurrently with a command.
 */
public interface TournamentRunner {
    String tournamentId();
    TournamentState snapshot();
    int currentSlot();
    TournamentStatus status();

    MatchState transition(String matchId, MatchStatus newStatus, MatchStatePatch patch);
    MatchState undo(String matchId);
    MatchState patch(String matchId, MatchStatePatch patch);
    Match updateSides(String matchId, List<String> sideA, List<String> sideB);

    /** @param slot slot to evaluate at, or null for the current slot */
    Map<String, TrafficLightResult> evaluateConflicts(Integer slot);
    List<PlayerStatus> playerStatuses(String matchId, Integer slot);
    List<CourtFillSuggestion> suggestCourtFills(Integer slot);
    void skipCourt(int courtId);

    /** @return moved assignments, the started match first */
    List<Assignment> startOnCourt(String matchId, int courtId);
    /** @return restored assignments; empty when nothing was recorded */
    List<Assignment> undoStart(String matchId);

    ImpactAnalysis analyzeImpact(String matchId, Integer projectedEndSlot);
    List<Assignment> overrunMatches();
    List<Assignment> impactedMatches();

    /** Starts a re-solve; the future completes once the new table is committed. */
    CompletableFuture<Schedule> triggerReoptimize();
    boolean isReoptimizing();

    TournamentDocument export();
    void replace(TournamentDocument document);
}
