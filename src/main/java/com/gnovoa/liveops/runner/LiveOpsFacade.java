package com.gnovoa.liveops.runner;

import com.gnovoa.liveops.api.dto.AssignmentsChangedResponse;
import com.gnovoa.liveops.api.dto.ConflictsResponse;
import com.gnovoa.liveops.api.dto.CourtFillsResponse;
import com.gnovoa.liveops.api.dto.OverrunsResponse;
import com.gnovoa.liveops.api.dto.ReoptimizeResponse;
import com.gnovoa.liveops.api.dto.TournamentStatusResponse;
import com.gnovoa.liveops.model.Schedule;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public final class LiveOpsFacade {

    private final TournamentRegistry registry;

    public LiveOpsFacade(TournamentRegistry registry) {
        this.registry = registry;
    }

    public TournamentStatusResponse status(String tournamentId) {
        return new TournamentStatusResponse(registry.runner(tournamentId).status(), ws(tournamentId));
    }

    public ConflictsResponse conflicts(String tournamentId, Integer slot) {
        TournamentRunner runner = registry.runner(tournamentId);
        int at = slot != null ? slot : runner.currentSlot();
        return new ConflictsResponse(tournamentId, at, runner.evaluateConflicts(at));
    }

    public CourtFillsResponse courtFills(String tournamentId, Integer slot) {
        TournamentRunner runner = registry.runner(tournamentId);
        int at = slot != null ? slot : runner.currentSlot();
        return new CourtFillsResponse(tournamentId, at, runner.suggestCourtFills(at));
    }

    public AssignmentsChangedResponse startOnCourt(String tournamentId, String matchId, int courtId) {
        return AssignmentsChangedResponse.moved(matchId, registry.runner(tournamentId).startOnCourt(matchId, courtId));
    }

    public AssignmentsChangedResponse undoStart(String tournamentId, String matchId) {
        return AssignmentsChangedResponse.restored(matchId, registry.runner(tournamentId).undoStart(matchId));
    }

    public OverrunsResponse overruns(String tournamentId) {
        TournamentRunner runner = registry.runner(tournamentId);
        return new OverrunsResponse(tournamentId, runner.overrunMatches(), runner.impactedMatches());
    }

    /**
     * Starts a re-solve. With {@code wait} the call blocks until the new table is committed and
     * solver failures propagate to the caller; otherwise the outcome arrives on the tournament
     * channel as {@code REOPTIMIZED} or {@code REOPTIMIZE_FAILED}.
     */
    public ReoptimizeResponse reoptimize(String tournamentId, boolean wait) {
        var future = registry.runner(tournamentId).triggerReoptimize();
        if (!wait) {
            return new ReoptimizeResponse(tournamentId, "RUNNING", null, ws(tournamentId));
        }
        Schedule schedule = future.join();
        return new ReoptimizeResponse(tournamentId, "APPLIED", schedule, ws(tournamentId));
    }

    private static Map<String, String> ws(String tournamentId) {
        return Map.of("tournament", "/ws/tournaments/" + tournamentId);
    }
}
