package com.gnovoa.liveops.runner;

import com.gnovoa.liveops.TestTournament;
import com.gnovoa.liveops.core.CascadingReassignment;
import com.gnovoa.liveops.core.ConflictEvaluator;
import com.gnovoa.liveops.core.CourtFillSuggester;
import com.gnovoa.liveops.core.CourtFillSuggestion;
import com.gnovoa.liveops.core.ImpactAnalyzer;
import com.gnovoa.liveops.core.InvalidTransitionException;
import com.gnovoa.liveops.core.MatchLifecycle;
import com.gnovoa.liveops.core.ReoptimizeInProgressException;
import com.gnovoa.liveops.core.SolverFailureException;
import com.gnovoa.liveops.core.TargetOccupiedException;
import com.gnovoa.liveops.events.LiveOpsEvent;
import com.gnovoa.liveops.events.LiveOpsEventType;
import com.gnovoa.liveops.model.Assignment;
import com.gnovoa.liveops.model.MatchState;
import com.gnovoa.liveops.model.MatchStatus;
import com.gnovoa.liveops.model.Schedule;
import com.gnovoa.liveops.model.SolverStatus;
import com.gnovoa.liveops.model.TournamentState;
import com.gnovoa.liveops.solver.ReoptimizationPlanner;
import com.gnovoa.liveops.solver.ScheduleSolver;
import com.gnovoa.liveops.solver.SolveRequest;
import com.gnovoa.liveops.solver.SolveResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LiveTournamentRunnerTest {

    private final ScheduleSolver solver = mock(ScheduleSolver.class);
    private final List<LiveOpsEvent> events = new CopyOnWriteArrayList<>();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private LiveTournamentRunner runner(TournamentState state, Clock clock) {
        return runner(state, clock, Duration.ofSeconds(5));
    }

    private LiveTournamentRunner runner(TournamentState state, Clock clock, Duration solverTimeout) {
        return new LiveTournamentRunner(
                state,
                new MatchLifecycle(clock),
                new ConflictEvaluator(true),
                new CourtFillSuggester(),
                new CascadingReassignment(),
                new ImpactAnalyzer(),
                new ReoptimizationPlanner(1.0, 1, 2),
                solver,
                executor,
                solverTimeout,
                events::add,
                clock);
    }

    private TournamentState courtOneQueue() {
        return TestTournament.withCourts(2)
                .match("M0", List.of("P0"), List.of("P9"), 1, 8, 2)
                .match("M5", List.of("P1"), List.of("P2"), 2, 10, 2)
                .match("M6", List.of("P3"), List.of("P4"), 1, 10, 2)
                .match("M7", List.of("P5"), List.of("P6"), 1, 11, 2)
                .status("M0", MatchStatus.FINISHED)
                .status("M5", MatchStatus.CALLED)
                .build();
    }

    private static SolveResponse solved(SolverStatus status, Assignment... assignments) {
        return new SolveResponse(status, 1.0, 40.0,
                Arrays.stream(assignments)
                        .map(a -> new SolveResponse.AssignmentResult(
                                a.matchId(), a.slotId(), a.courtId(), a.durationSlots(), false, null, null))
                        .toList(),
                null, List.of("court 2 overbooked"), null, 0, 0);
    }

    @Test
    void transitionCommitsAndPublishes() {
        LiveTournamentRunner runner = runner(courtOneQueue(), TestTournament.clockAtSlot(10));

        MatchState s = runner.transition("M6", MatchStatus.CALLED, null);

        assertThat(runner.snapshot().stateOf("M6")).isEqualTo(s);
        assertThat(events).singleElement()
                .satisfies(e -> {
                    assertThat(e.type()).isEqualTo(LiveOpsEventType.MATCH_STATE_CHANGED);
                    assertThat(e.matchId()).isEqualTo("M6");
                    assertThat(e.tournamentId()).isEqualTo("t-test");
                });
    }

    @Test
    void rejectedTransitionChangesNothing() {
        LiveTournamentRunner runner = runner(courtOneQueue(), TestTournament.clockAtSlot(10));
        TournamentState before = runner.snapshot();

        assertThatThrownBy(() -> runner.transition("M6", MatchStatus.FINISHED, null))
                .isInstanceOf(InvalidTransitionException.class);

        assertThat(runner.snapshot()).isSameAs(before);
        assertThat(events).isEmpty();
    }

    @Test
    void startOnCourtThenUndoIsAnExactInverse() {
        LiveTournamentRunner runner = runner(courtOneQueue(), TestTournament.clockAtSlot(10));
        List<Assignment> before = runner.snapshot().assignments();

        List<Assignment> moved = runner.startOnCourt("M5", 1);

        assertThat(moved).containsExactly(
                new Assignment("M5", 1, 10, 2),
                new Assignment("M6", 1, 12, 2),
                new Assignment("M7", 1, 14, 2));
        MatchState started = runner.snapshot().stateOf("M5");
        assertThat(started.status()).isEqualTo(MatchStatus.STARTED);
        assertThat(started.actualCourtId()).isEqualTo(1);
        assertThat(started.actualStartTime()).isNotNull();

        List<Assignment> restored = runner.undoStart("M5");

        TournamentState after = runner.snapshot();
        assertThat(restored).extracting(Assignment::matchId).containsExactly("M5", "M6", "M7");
        assertThat(after.assignments()).isEqualTo(before);
        assertThat(after.statusOf("M5")).isEqualTo(MatchStatus.CALLED);
        assertThat(after.stateOf("M5").actualCourtId()).isNull();
        assertThat(after.stateOf("M5").actualStartTime()).isNull();
        for (String id : List.of("M5", "M6", "M7")) {
            assertThat(after.stateOf(id).hasOriginalPosition()).as(id).isFalse();
        }
    }

    @Test
    void startOnCourtPublishesScheduleBeforeTheStart() {
        LiveTournamentRunner runner = runner(courtOneQueue(), TestTournament.clockAtSlot(10));

        runner.startOnCourt("M5", 1);

        assertThat(events.get(0).type()).isEqualTo(LiveOpsEventType.SCHEDULE_CHANGED);
        LiveOpsEvent last = events.get(events.size() - 1);
        assertThat(last.type()).isEqualTo(LiveOpsEventType.MATCH_STATE_CHANGED);
        assertThat(last.matchState().status()).isEqualTo(MatchStatus.STARTED);
    }

    @Test
    void occupiedTargetIsRejectedBeforeAnyMutation() {
        TournamentState state = TestTournament.withCourts(2)
                .match("LIVE", List.of("P7"), List.of("P8"), 1, 10, 2)
                .match("M5", List.of("P1"), List.of("P2"), 2, 10, 2)
                .status("LIVE", MatchStatus.STARTED)
                .status("M5", MatchStatus.CALLED)
                .build();
        LiveTournamentRunner runner = runner(state, TestTournament.clockAtSlot(10));

        assertThatThrownBy(() -> runner.startOnCourt("M5", 1))
                .isInstanceOf(TargetOccupiedException.class)
                .hasMessageContaining("LIVE");

        assertThat(runner.snapshot()).isSameAs(state);
        assertThat(events).isEmpty();
    }

    @Test
    void onlyCalledMatchesCanStartOnACourt() {
        LiveTournamentRunner runner = runner(courtOneQueue(), TestTournament.clockAtSlot(10));

        assertThatThrownBy(() -> runner.startOnCourt("M6", 2)).isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void undoStartWithoutDisplacementIsANoOp() {
        LiveTournamentRunner runner = runner(courtOneQueue(), TestTournament.clockAtSlot(10));
        TournamentState before = runner.snapshot();

        assertThat(runner.undoStart("M6")).isEmpty();
        assertThat(runner.snapshot()).isSameAs(before);
    }

    @Test
    void reoptimizeFreezesCommittedWork() {
        LiveTournamentRunner runner = runner(courtOneQueue(), TestTournament.clockAtSlot(10));
        runner.startOnCourt("M5", 1);
        when(solver.solve(any())).thenReturn(solved(SolverStatus.FEASIBLE,
                new Assignment("M0", 2, 0, 2),
                new Assignment("M5", 2, 12, 2),
                new Assignment("M6", 2, 14, 2),
                new Assignment("M7", 1, 12, 2)));

        Schedule schedule = runner.triggerReoptimize().join();

        TournamentState after = runner.snapshot();
        assertThat(after.assignment("M0")).contains(new Assignment("M0", 1, 8, 2));
        assertThat(after.assignment("M5")).contains(new Assignment("M5", 1, 10, 2));
        assertThat(after.assignment("M6")).contains(new Assignment("M6", 2, 14, 2));
        assertThat(after.stateOf("M6").hasOriginalPosition()).isFalse();
        assertThat(schedule.status()).isEqualTo(SolverStatus.FEASIBLE);
        assertThat(runner.isReoptimizing()).isFalse();
        assertThat(events).extracting(LiveOpsEvent::type).contains(LiveOpsEventType.REOPTIMIZED);

        ArgumentCaptor<SolveRequest> request = ArgumentCaptor.forClass(SolveRequest.class);
        verify(solver).solve(request.capture());
        assertThat(request.getValue().previousAssignments())
                .filteredOn(SolveRequest.PreviousAssignment::locked)
                .extracting(SolveRequest.PreviousAssignment::matchId)
                .containsExactlyInAnyOrder("M0", "M5");
        assertThat(request.getValue().config().freezeHorizonSlots()).isEqualTo(2);
        assertThat(request.getValue().config().currentSlot()).isEqualTo(10);
    }

    @Test
    void secondReoptimizeWhileOneIsRunningIsRejected() throws Exception {
        LiveTournamentRunner runner = runner(courtOneQueue(), TestTournament.clockAtSlot(10));
        CountDownLatch release = new CountDownLatch(1);
        when(solver.solve(any())).thenAnswer(inv -> {
            release.await();
            return solved(SolverStatus.OPTIMAL, runner.snapshot().assignments().toArray(new Assignment[0]));
        });

        CompletableFuture<Schedule> first = runner.triggerReoptimize();

        assertThat(runner.isReoptimizing()).isTrue();
        assertThat(runner.status().reoptimizing()).isTrue();
        assertThatThrownBy(runner::triggerReoptimize).isInstanceOf(ReoptimizeInProgressException.class);

        release.countDown();
        first.join();
        assertThat(runner.isReoptimizing()).isFalse();
    }

    @Test
    void infeasibleAnswerLeavesTheTableUntouched() {
        LiveTournamentRunner runner = runner(courtOneQueue(), TestTournament.clockAtSlot(10));
        TournamentState before = runner.snapshot();
        when(solver.solve(any())).thenReturn(solved(SolverStatus.INFEASIBLE));

        CompletableFuture<Schedule> future = runner.triggerReoptimize();

        assertThatThrownBy(future::join)
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOf(SolverFailureException.class)
                .satisfies(e -> {
                    SolverFailureException failure = (SolverFailureException) e;
                    assertThat(failure.code()).isEqualTo("solver_infeasible");
                    assertThat(failure.infeasibleReasons()).containsExactly("court 2 overbooked");
                });
        assertThat(runner.snapshot()).isSameAs(before);
        assertThat(runner.isReoptimizing()).isFalse();
        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.type()).isEqualTo(LiveOpsEventType.REOPTIMIZE_FAILED);
            assertThat(e.failure().code()).isEqualTo("solver_infeasible");
            assertThat(e.failure().details()).containsExactly("court 2 overbooked");
        });
    }

    @Test
    void solverThatMissesTheDeadlineLeavesTheTableUntouched() {
        LiveTournamentRunner runner = runner(courtOneQueue(), TestTournament.clockAtSlot(10), Duration.ofMillis(200));
        TournamentState before = runner.snapshot();
        CountDownLatch release = new CountDownLatch(1);
        when(solver.solve(any())).thenAnswer(inv -> {
            release.await();
            return solved(SolverStatus.OPTIMAL);
        });
        try {
            CompletableFuture<Schedule> future = runner.triggerReoptimize();

            assertThatThrownBy(future::join)
                    .isInstanceOf(CompletionException.class)
                    .cause()
                    .isInstanceOf(SolverFailureException.class)
                    .hasMessageContaining("did not answer in time");
            assertThat(runner.snapshot()).isSameAs(before);
            assertThat(runner.isReoptimizing()).isFalse();
            assertThat(events).singleElement().satisfies(e -> {
                assertThat(e.type()).isEqualTo(LiveOpsEventType.REOPTIMIZE_FAILED);
                assertThat(e.failure().code()).isEqualTo("solver_failure");
                assertThat(e.failure().message()).contains("did not answer in time");
            });
        } finally {
            release.countDown();
        }
    }

    @Test
    void solverCallFailureLeavesTheTableUntouched() {
        LiveTournamentRunner runner = runner(courtOneQueue(), TestTournament.clockAtSlot(10));
        TournamentState before = runner.snapshot();
        when(solver.solve(any())).thenThrow(new SolverFailureException("connection refused", null));

        assertThatThrownBy(() -> runner.triggerReoptimize().join())
                .hasCauseInstanceOf(SolverFailureException.class);
        assertThat(runner.snapshot()).isSameAs(before);
        assertThat(runner.isReoptimizing()).isFalse();
        assertThat(events).extracting(e -> e.failure().message()).containsExactly("connection refused");
    }

    @Test
    void skippedSuggestionReturnsOnceAnotherCourtFrees() {
        TournamentState state = TestTournament.withCourts(3)
                .match("M1", List.of("P1"), List.of("P2"), 1, 0, 1)
                .match("M2", List.of("P3"), List.of("P4"), 2, 0, 2)
                .match("M3", List.of("P5"), List.of("P6"), 3, 0, 2)
                .match("M4", List.of("P7"), List.of("P8"), 2, 2, 2)
                .match("M5", List.of("P9"), List.of("P10"), 3, 2, 2)
                .status("M1", MatchStatus.FINISHED)
                .status("M2", MatchStatus.STARTED)
                .status("M3", MatchStatus.STARTED)
                .build();
        LiveTournamentRunner runner = runner(state, TestTournament.clockAtSlot(1));
        assertThat(runner.suggestCourtFills(null)).extracting(CourtFillSuggestion::suggestedMatchId).containsExactly("M4");

        runner.skipCourt(1);
        assertThat(runner.suggestCourtFills(null)).isEmpty();

        runner.transition("M2", MatchStatus.FINISHED, null);
        assertThat(runner.suggestCourtFills(null)).extracting(CourtFillSuggestion::courtId).containsExactly(1, 2);
    }

    @Test
    void statusCountsMatchesPerLifecycleStep() {
        LiveTournamentRunner runner = runner(courtOneQueue(), TestTournament.clockAtSlot(10));

        TournamentStatus status = runner.status();

        assertThat(status.total()).isEqualTo(4);
        assertThat(status.finished()).isEqualTo(1);
        assertThat(status.called()).isEqualTo(1);
        assertThat(status.scheduled()).isEqualTo(2);
        assertThat(status.remaining()).isEqualTo(3);
        assertThat(status.percentComplete()).isEqualTo(25);
        assertThat(status.currentSlot()).isEqualTo(10);
    }

    @Test
    void updateSidesKeepsAssignment() {
        LiveTournamentRunner runner = runner(courtOneQueue(), TestTournament.clockAtSlot(10));

        runner.updateSides("M6", List.of("P3"), List.of("P11"));

        assertThat(runner.snapshot().playerIdsOf("M6")).containsExactly("P3", "P11");
        assertThat(runner.snapshot().assignment("M6")).contains(new Assignment("M6", 1, 10, 2));
    }
}
