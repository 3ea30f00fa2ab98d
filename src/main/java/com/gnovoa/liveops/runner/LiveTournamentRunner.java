package com.gnovoa.liveops.runner;

import com.gnovoa.liveops.core.CascadeResult;
import com.gnovoa.liveops.core.CascadingReassignment;
import com.gnovoa.liveops.core.ConflictEvaluator;
import com.gnovoa.liveops.core.CourtFillSuggester;
import com.gnovoa.liveops.core.CourtFillSuggestion;
import com.gnovoa.liveops.core.FreeCourt;
import com.gnovoa.liveops.core.ImpactAnalysis;
import com.gnovoa.liveops.core.ImpactAnalyzer;
import com.gnovoa.liveops.core.InvalidTransitionException;
import com.gnovoa.liveops.core.LiveOpsException;
import com.gnovoa.liveops.core.MatchLifecycle;
import com.gnovoa.liveops.core.NotFoundException;
import com.gnovoa.liveops.core.PlayerStatus;
import com.gnovoa.liveops.core.ReoptimizeInProgressException;
import com.gnovoa.liveops.core.SlotClock;
import com.gnovoa.liveops.core.SolverFailureException;
import com.gnovoa.liveops.core.TargetOccupiedException;
import com.gnovoa.liveops.core.TrafficLightResult;
import com.gnovoa.liveops.events.LiveOpsEvent;
import com.gnovoa.liveops.model.Assignment;
import com.gnovoa.liveops.model.Match;
import com.gnovoa.liveops.model.MatchState;
import com.gnovoa.liveops.model.MatchStatePatch;
import com.gnovoa.liveops.model.MatchStatus;
import com.gnovoa.liveops.model.Schedule;
import com.gnovoa.liveops.model.TournamentDocument;
import com.gnovoa.liveops.model.TournamentState;
import com.gnovoa.liveops.out.EventPublisher;
import com.gnovoa.liveops.solver.ReoptimizationPlanner;
import com.gnovoa.liveops.solver.ScheduleSolver;
import com.gnovoa.liveops.solver.SolveRequest;
import com.gnovoa.liveops.solver.SolveResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * In-memory runner for one tournament.
 *
 * <p>The committed tables live in one immutable {@link TournamentState} behind a volatile field.
 * Mutators are synchronized and replace it in a single write, so a reader sees either all of a
 * command's effects or none of them. Every committed change is handed to the
 * {@link EventPublisher}, which never blocks.
 */
public final class LiveTournamentRunner implements TournamentRunner {

    private static final Logger log = LoggerFactory.getLogger(LiveTournamentRunner.class);

    private final MatchLifecycle lifecycle;
    private final ConflictEvaluator conflicts;
    private final CourtFillSuggester courtFill;
    private final CascadingReassignment cascade;
    private final ImpactAnalyzer impact;
    private final ReoptimizationPlanner planner;
    private final ScheduleSolver solver;
    private final Executor solverExecutor;
    private final Duration solverTimeout;
    private final EventPublisher publisher;
    private final Clock clock;

    private final AtomicBoolean reoptimizing = new AtomicBoolean(false);

    private volatile TournamentState state;

    // dismissed court-fill suggestions, valid while the free-court set stays the same
    private final Set<Integer> skippedCourts = new HashSet<>();
    private Set<Integer> skippedAgainst = Set.of();

    public LiveTournamentRunner(
            TournamentState initial,
            MatchLifecycle lifecycle,
            ConflictEvaluator conflicts,
            CourtFillSuggester courtFill,
            CascadingReassignment cascade,
            ImpactAnalyzer impact,
            ReoptimizationPlanner planner,
            ScheduleSolver solver,
            Executor solverExecutor,
            Duration solverTimeout,
            EventPublisher publisher,
            Clock clock
    ) {
        this.state = initial;
        this.lifecycle = lifecycle;
        this.conflicts = conflicts;
        this.courtFill = courtFill;
        this.cascade = cascade;
        this.impact = impact;
        this.planner = planner;
        this.solver = solver;
        this.solverExecutor = solverExecutor;
        this.solverTimeout = solverTimeout;
        this.publisher = publisher;
        this.clock = clock;
    }

    @Override public String tournamentId() { return state.tournamentId(); }

    @Override public TournamentState snapshot() { return state; }

    @Override
    public int currentSlot() {
        return new SlotClock(state.config()).currentSlot(clock);
    }

    @Override
    public TournamentStatus status() {
        TournamentState s = state;
        Map<MatchStatus, Integer> counts = new EnumMap<>(MatchStatus.class);
        for (Assignment a : s.assignments()) {
            counts.merge(s.statusOf(a.matchId()), 1, Integer::sum);
        }
        int total = s.assignments().size();
        int finished = counts.getOrDefault(MatchStatus.FINISHED, 0);
        return new TournamentStatus(
                s.tournamentId(),
                total,
                counts.getOrDefault(MatchStatus.SCHEDULED, 0),
                counts.getOrDefault(MatchStatus.CALLED, 0),
                counts.getOrDefault(MatchStatus.STARTED, 0),
                finished,
                total - finished,
                total == 0 ? 0 : Math.round(finished * 100f / total),
                new SlotClock(s.config()).currentSlot(clock),
                reoptimizing.get()
        );
    }

    // ---- lifecycle ----

    @Override
    public synchronized MatchState transition(String matchId, MatchStatus newStatus, MatchStatePatch patch) {
        MatchStatus from = state.statusOf(matchId);
        MatchState next = lifecycle.transition(state, matchId, newStatus, patch);
        commitState(next);
        log.info("[{}] {} {} -> {}", tournamentId(), matchId, from, newStatus);
        return next;
    }

    @Override
    public synchronized MatchState undo(String matchId) {
        MatchStatus from = state.statusOf(matchId);
        MatchState next = lifecycle.undo(state, matchId);
        commitState(next);
        log.info("[{}] {} undo {} -> {}", tournamentId(), matchId, from, next.status());
        return next;
    }

    @Override
    public synchronized MatchState patch(String matchId, MatchStatePatch patch) {
        MatchState next = lifecycle.patch(state, matchId, patch);
        commitState(next);
        log.info("[{}] {} patched", tournamentId(), matchId);
        return next;
    }

    @Override
    public synchronized Match updateSides(String matchId, List<String> sideA, List<String> sideB) {
        Match match = state.match(matchId).orElseThrow(() -> NotFoundException.match(matchId));
        Match updated = match.withSides(sideA, sideB);
        state = state.withMatch(updated);
        log.info("[{}] {} sides now {} vs {}", tournamentId(), matchId, sideA, sideB);
        publisher.publish(LiveOpsEvent.scheduleChanged(tournamentId(), matchId, List.of(), clock.instant()));
        return updated;
    }

    // ---- readers ----

    @Override
    public Map<String, TrafficLightResult> evaluateConflicts(Integer slot) {
        TournamentState s = state;
        return conflicts.evaluateConflicts(s, slotOr(s, slot));
    }

    @Override
    public List<PlayerStatus> playerStatuses(String matchId, Integer slot) {
        TournamentState s = state;
        if (s.match(matchId).isEmpty()) throw NotFoundException.match(matchId);
        return conflicts.playerStatuses(s, matchId, slotOr(s, slot));
    }

    @Override
    public List<CourtFillSuggestion> suggestCourtFills(Integer slot) {
        TournamentState s = state;
        int at = slotOr(s, slot);
        Set<Integer> skipped = skipsFor(freeCourtIds(s, at));
        return courtFill.suggestCourtFills(s, conflicts.evaluateConflicts(s, at), at, skipped);
    }

    @Override
    public void skipCourt(int courtId) {
        TournamentState s = state;
        Set<Integer> free = freeCourtIds(s, new SlotClock(s.config()).currentSlot(clock));
        synchronized (skippedCourts) {
            if (!free.equals(skippedAgainst)) skippedCourts.clear();
            skippedCourts.add(courtId);
            skippedAgainst = free;
        }
    }

    @Override
    public ImpactAnalysis analyzeImpact(String matchId, Integer projectedEndSlot) {
        return impact.analyzeImpact(state, matchId, projectedEndSlot);
    }

    @Override
    public List<Assignment> overrunMatches() {
        return impact.overrunMatches(state);
    }

    @Override
    public List<Assignment> impactedMatches() {
        return impact.impactedMatches(state);
    }

    // ---- court reassignment ----

    @Override
    public synchronized List<Assignment> startOnCourt(String matchId, int courtId) {
        MatchStatus status = state.statusOf(matchId);
        if (state.match(matchId).isEmpty()) throw NotFoundException.match(matchId);
        if (status != MatchStatus.CALLED) {
            throw new InvalidTransitionException(matchId, status, MatchStatus.STARTED);
        }
        if (courtId < 1 || courtId > state.config().courtCount()) {
            throw new NotFoundException("Unknown court " + courtId);
        }
        cascade.startedMatchOn(state, courtId, matchId).ifPresent(occupant -> {
            throw new TargetOccupiedException(courtId, occupant);
        });

        CascadeResult result = cascade.startOnCourt(state, matchId, courtId);

        // displacements first, then the start itself
        TournamentState moved = state.withAssignments(result.assignments()).withMatchStates(merged(result.updatedStates()));
        MatchState started = lifecycle.transition(moved, matchId, MatchStatus.STARTED,
                new MatchStatePatch(null, null, courtId, null, null, null, null, null, null, null));
        state = moved.withMatchState(started);

        log.info("[{}] {} started on court {}, moved {}", tournamentId(), matchId, courtId, ids(result.movedAssignments()));
        publisher.publish(LiveOpsEvent.scheduleChanged(tournamentId(), matchId, result.movedAssignments(), clock.instant()));
        publishStates(result.updatedStates().keySet(), matchId);
        publisher.publish(LiveOpsEvent.matchStateChanged(tournamentId(), started, clock.instant()));
        return result.movedAssignments();
    }

    @Override
    public synchronized List<Assignment> undoStart(String matchId) {
        if (state.match(matchId).isEmpty()) throw NotFoundException.match(matchId);
        MatchState current = state.stateOf(matchId);
        if (!current.hasOriginalPosition()) {
            log.info("[{}] {} undo-start: nothing recorded", tournamentId(), matchId);
            return List.of();
        }
        if (current.status() != MatchStatus.STARTED) {
            throw new InvalidTransitionException(matchId, current.status(), MatchStatus.CALLED);
        }

        CascadeResult result = cascade.undoStart(state, matchId).orElseThrow();

        TournamentState restored = state.withAssignments(result.assignments()).withMatchStates(merged(result.updatedStates()));
        MatchState cleared = restored.stateOf(matchId).toBuilder().actualCourtId(null).build();
        restored = restored.withMatchState(cleared);
        MatchState reverted = lifecycle.undo(restored, matchId);
        state = restored.withMatchState(reverted);

        log.info("[{}] {} start undone, restored {}", tournamentId(), matchId, ids(result.movedAssignments()));
        publisher.publish(LiveOpsEvent.scheduleChanged(tournamentId(), matchId, result.movedAssignments(), clock.instant()));
        publishStates(result.updatedStates().keySet(), matchId);
        publisher.publish(LiveOpsEvent.matchStateChanged(tournamentId(), reverted, clock.instant()));
        return result.movedAssignments();
    }

    // ---- re-solve ----

    @Override
    public CompletableFuture<Schedule> triggerReoptimize() {
        if (!reoptimizing.compareAndSet(false, true)) {
            throw new ReoptimizeInProgressException(tournamentId());
        }

        SolveRequest request;
        try {
            TournamentState s = state;
            request = planner.buildRequest(s, new SlotClock(s.config()).currentSlot(clock));
        } catch (RuntimeException e) {
            reoptimizing.set(false);
            throw e;
        }
        log.info("[{}] reoptimize requested ({} locked/pinned hints, freeze horizon {})",
                tournamentId(), request.previousAssignments().size(), request.config().freezeHorizonSlots());

        return CompletableFuture.supplyAsync(() -> solver.solve(request), solverExecutor)
                .orTimeout(solverTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null) throw asSolverFailure(error);
                    return apply(response);
                })
                .whenComplete((schedule, error) -> {
                    reoptimizing.set(false);
                    if (error != null) {
                        LiveOpsException failure = asSolverFailure(error);
                        log.warn("[{}] reoptimize failed, schedule unchanged: {}", tournamentId(), failure.getMessage());
                        publisher.publish(LiveOpsEvent.reoptimizeFailed(tournamentId(), failure, clock.instant()));
                    }
                });
    }

    @Override
    public boolean isReoptimizing() {
        return reoptimizing.get();
    }

    private synchronized Schedule apply(SolveResponse response) {
        if (!response.status().isActionable()) {
            throw new SolverFailureException(response.status(), response.infeasibleReasons());
        }
        state = planner.merge(state, response.toSchedule());
        log.info("[{}] reoptimize applied: {} with {} assignments, {} unscheduled",
                tournamentId(), response.status(), state.assignments().size(), response.unscheduledMatches().size());
        publisher.publish(LiveOpsEvent.reoptimized(tournamentId(), state.assignments(), clock.instant()));
        return state.schedule();
    }

    // ---- export / import ----

    @Override
    public TournamentDocument export() {
        return state.toDocument();
    }

    @Override
    public synchronized void replace(TournamentDocument document) {
        TournamentCatalog.requireValid(document);
        state = TournamentState.fromDocument(document);
        synchronized (skippedCourts) {
            skippedCourts.clear();
            skippedAgainst = Set.of();
        }
        log.info("[{}] replaced from document ({} matches)", tournamentId(), state.matches().size());
        publisher.publish(LiveOpsEvent.reoptimized(tournamentId(), state.assignments(), clock.instant()));
    }

    // ---- helpers ----

    private void commitState(MatchState next) {
        state = state.withMatchState(next);
        publisher.publish(LiveOpsEvent.matchStateChanged(tournamentId(), next, clock.instant()));
    }

    private Map<String, MatchState> merged(Map<String, MatchState> updates) {
        Map<String, MatchState> copy = new LinkedHashMap<>(state.matchStates());
        copy.putAll(updates);
        return copy;
    }

    private void publishStates(Set<String> matchIds, String except) {
        for (String id : matchIds) {
            if (id.equals(except)) continue;
            publisher.publish(LiveOpsEvent.matchStateChanged(tournamentId(), state.stateOf(id), clock.instant()));
        }
    }

    private Set<Integer> skipsFor(Set<Integer> free) {
        synchronized (skippedCourts) {
            if (!free.equals(skippedAgainst)) {
                skippedCourts.clear();
                skippedAgainst = Set.of();
            }
            return Set.copyOf(skippedCourts);
        }
    }

    private Set<Integer> freeCourtIds(TournamentState s, int slot) {
        return courtFill.findFreeCourts(s, slot).stream().map(FreeCourt::courtId).collect(Collectors.toSet());
    }

    private int slotOr(TournamentState s, Integer slot) {
        return slot != null ? slot : new SlotClock(s.config()).currentSlot(clock);
    }

    private static List<String> ids(List<Assignment> assignments) {
        return assignments.stream().map(Assignment::matchId).toList();
    }

    private static LiveOpsException asSolverFailure(Throwable error) {
        Throwable cause = rootCause(error);
        if (cause instanceof LiveOpsException e) return e;
        if (cause instanceof TimeoutException) {
            return new SolverFailureException("Solver did not answer in time", cause);
        }
        return new SolverFailureException("Solver call failed: " + cause.getMessage(), cause);
    }

    private static Throwable rootCause(Throwable error) {
        Throwable t = error;
        while (t instanceof CompletionException && t.getCause() != null) t = t.getCause();
        return t;
    }
}
