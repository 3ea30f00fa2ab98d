package com.gnovoa.liveops.api;

import com.gnovoa.liveops.api.dto.AssignmentsChangedResponse;
import com.gnovoa.liveops.api.dto.ConflictsResponse;
import com.gnovoa.liveops.api.dto.CourtFillsResponse;
import com.gnovoa.liveops.api.dto.OverrunsResponse;
import com.gnovoa.liveops.api.dto.ReoptimizeResponse;
import com.gnovoa.liveops.api.dto.SidesRequest;
import com.gnovoa.liveops.api.dto.StartOnCourtRequest;
import com.gnovoa.liveops.api.dto.TournamentStatusResponse;
import com.gnovoa.liveops.api.dto.TransitionRequest;
import com.gnovoa.liveops.core.ImpactAnalysis;
import com.gnovoa.liveops.core.PlayerStatus;
import com.gnovoa.liveops.model.Match;
import com.gnovoa.liveops.model.MatchState;
import com.gnovoa.liveops.model.MatchStatePatch;
import com.gnovoa.liveops.model.TournamentDocument;
import com.gnovoa.liveops.runner.LiveOpsFacade;
import com.gnovoa.liveops.runner.TournamentRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/tournaments")
public class LiveOpsController {

    private final LiveOpsFacade facade;
    private final TournamentRegistry registry;

    public LiveOpsController(LiveOpsFacade facade, TournamentRegistry registry) {
        this.facade = facade;
        this.registry = registry;
    }

    @GetMapping
    public List<String> tournaments() {
        return registry.tournamentIds();
    }

    @PutMapping("/{tournamentId}")
    public ResponseEntity<TournamentStatusResponse> importTournament(
            @PathVariable String tournamentId, @RequestBody TournamentDocument document) {
        registry.register(new TournamentDocument(
                tournamentId, document.config(), document.players(), document.matches(),
                document.schedule(), document.matchStates()));
        return ResponseEntity.ok(facade.status(tournamentId));
    }

    @GetMapping("/{tournamentId}/export")
    public TournamentDocument export(@PathVariable String tournamentId) {
        return registry.runner(tournamentId).export();
    }

    @GetMapping("/{tournamentId}/status")
    public TournamentStatusResponse status(@PathVariable String tournamentId) {
        return facade.status(tournamentId);
    }

    @GetMapping("/{tournamentId}/match-states")
    public Map<String, MatchState> matchStates(@PathVariable String tournamentId) {
        return registry.runner(tournamentId).snapshot().matchStates();
    }

    @PostMapping("/{tournamentId}/matches/{matchId}/transition")
    public MatchState transition(
            @PathVariable String tournamentId, @PathVariable String matchId, @RequestBody TransitionRequest body) {
        return registry.runner(tournamentId).transition(matchId, body.status(), body.patch());
    }

    @PostMapping("/{tournamentId}/matches/{matchId}/undo")
    public MatchState undo(@PathVariable String tournamentId, @PathVariable String matchId) {
        return registry.runner(tournamentId).undo(matchId);
    }

    @PatchMapping("/{tournamentId}/matches/{matchId}/state")
    public MatchState patch(
            @PathVariable String tournamentId, @PathVariable String matchId, @RequestBody MatchStatePatch patch) {
        return registry.runner(tournamentId).patch(matchId, patch);
    }

    @PutMapping("/{tournamentId}/matches/{matchId}/sides")
    public Match sides(@PathVariable String tournamentId, @PathVariable String matchId, @RequestBody SidesRequest body) {
        return registry.runner(tournamentId).updateSides(matchId, body.sideA(), body.sideB());
    }

    @GetMapping("/{tournamentId}/matches/{matchId}/players")
    public List<PlayerStatus> players(
            @PathVariable String tournamentId, @PathVariable String matchId, @RequestParam(required = false) Integer slot) {
        return registry.runner(tournamentId).playerStatuses(matchId, slot);
    }

    @GetMapping("/{tournamentId}/conflicts")
    public ConflictsResponse conflicts(@PathVariable String tournamentId, @RequestParam(required = false) Integer slot) {
        return facade.conflicts(tournamentId, slot);
    }

    @GetMapping("/{tournamentId}/court-fills")
    public CourtFillsResponse courtFills(@PathVariable String tournamentId, @RequestParam(required = false) Integer slot) {
        return facade.courtFills(tournamentId, slot);
    }

    @PostMapping("/{tournamentId}/court-fills/{courtId}/skip")
    public ResponseEntity<Void> skip(@PathVariable String tournamentId, @PathVariable int courtId) {
        registry.runner(tournamentId).skipCourt(courtId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{tournamentId}/matches/{matchId}/start-on-court")
    public AssignmentsChangedResponse startOnCourt(
            @PathVariable String tournamentId, @PathVariable String matchId, @RequestBody StartOnCourtRequest body) {
        return facade.startOnCourt(tournamentId, matchId, body.courtId());
    }

    @PostMapping("/{tournamentId}/matches/{matchId}/undo-start")
    public AssignmentsChangedResponse undoStart(@PathVariable String tournamentId, @PathVariable String matchId) {
        return facade.undoStart(tournamentId, matchId);
    }

    @GetMapping("/{tournamentId}/matches/{matchId}/impact")
    public ImpactAnalysis impact(
            @PathVariable String tournamentId,
            @PathVariable String matchId,
            @RequestParam(required = false) Integer projectedEndSlot) {
        return registry.runner(tournamentId).analyzeImpact(matchId, projectedEndSlot);
    }

    @GetMapping("/{tournamentId}/overruns")
    public OverrunsResponse overruns(@PathVariable String tournamentId) {
        return facade.overruns(tournamentId);
    }

    @PostMapping("/{tournamentId}/reoptimize")
    public ResponseEntity<ReoptimizeResponse> reoptimize(
            @PathVariable String tournamentId, @RequestParam(defaultValue = "false") boolean wait) {
        ReoptimizeResponse body = facade.reoptimize(tournamentId, wait);
        return ResponseEntity.status(wait ? HttpStatus.OK : HttpStatus.ACCEPTED).body(body);
    }
}
