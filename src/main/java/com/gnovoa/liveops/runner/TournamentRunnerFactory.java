package com.gnovoa.liveops.runner;

import com.gnovoa.liveops.core.CascadingReassignment;
import com.gnovoa.liveops.core.ConflictEvaluator;
import com.gnovoa.liveops.core.CourtFillSuggester;
import com.gnovoa.liveops.core.ImpactAnalyzer;
import com.gnovoa.liveops.core.MatchLifecycle;
import com.gnovoa.liveops.model.TournamentDocument;
import com.gnovoa.liveops.model.TournamentState;
import com.gnovoa.liveops.out.EventPublisher;
import com.gnovoa.liveops.solver.ReoptimizationPlanner;
import com.gnovoa.liveops.solver.ScheduleSolver;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

public final class TournamentRunnerFactory {

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

    public TournamentRunnerFactory(
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

    public TournamentRunner create(TournamentDocument document) {
        TournamentCatalog.requireValid(document);
        return new LiveTournamentRunner(
                TournamentState.fromDocument(document),
                lifecycle, conflicts, courtFill, cascade, impact,
                planner, solver, solverExecutor, solverTimeout,
                publisher, clock);
    }
}
