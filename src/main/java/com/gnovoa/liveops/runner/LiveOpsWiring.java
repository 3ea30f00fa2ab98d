package com.gnovoa.liveops.runner;

import com.gnovoa.liveops.core.CascadingReassignment;
import com.gnovoa.liveops.core.ConflictEvaluator;
import com.gnovoa.liveops.core.CourtFillSuggester;
import com.gnovoa.liveops.core.ImpactAnalyzer;
import com.gnovoa.liveops.core.MatchLifecycle;
import com.gnovoa.liveops.out.EventPublisher;
import com.gnovoa.liveops.out.RemoteMatchStateMirror;
import com.gnovoa.liveops.solver.HttpScheduleSolver;
import com.gnovoa.liveops.solver.ReoptimizationPlanner;
import com.gnovoa.liveops.solver.ScheduleSolver;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class LiveOpsWiring {

    private static final Duration SOLVER_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public MatchLifecycle matchLifecycle(Clock clock) {
        return new MatchLifecycle(clock);
    }

    @Bean
    public ConflictEvaluator conflictEvaluator(LiveOpsProperties props) {
        return new ConflictEvaluator(props.conflicts().calledBlocks());
    }

    @Bean
    public CourtFillSuggester courtFillSuggester() {
        return new CourtFillSuggester();
    }

    @Bean
    public CascadingReassignment cascadingReassignment() {
        return new CascadingReassignment();
    }

    @Bean
    public ImpactAnalyzer impactAnalyzer() {
        return new ImpactAnalyzer();
    }

    @Bean
    public ReoptimizationPlanner reoptimizationPlanner(LiveOpsProperties props) {
        var s = props.solver();
        return new ReoptimizationPlanner(s.timeLimitSeconds(), s.numWorkers(), s.minFreezeHorizonSlots());
    }

    @Bean
    @ConditionalOnMissingBean(ScheduleSolver.class)
    public ScheduleSolver scheduleSolver(RestClient.Builder builder, LiveOpsProperties props) {
        return new HttpScheduleSolver(builder.clone()
                .baseUrl(props.solver().baseUrl())
                .requestFactory(solverRequestFactory(props.solver()))
                .build());
    }

    /** The read timeout equals the runner's deadline, so a call the runner gave up on ends too. */
    static ClientHttpRequestFactory solverRequestFactory(LiveOpsProperties.Solver solver) {
        return ClientHttpRequestFactories.get(ClientHttpRequestFactorySettings.DEFAULTS
                .withConnectTimeout(SOLVER_CONNECT_TIMEOUT)
                .withReadTimeout(solver.callTimeout()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "liveops.sync", name = "remote-url")
    public RemoteMatchStateMirror remoteMatchStateMirror(RestClient.Builder builder, LiveOpsProperties props) {
        return new RemoteMatchStateMirror(builder.clone().baseUrl(props.sync().remoteUrl()).build());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService solverExecutor() {
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "liveops-solver");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public TournamentRunnerFactory tournamentRunnerFactory(
            MatchLifecycle lifecycle,
            ConflictEvaluator conflicts,
            CourtFillSuggester courtFill,
            CascadingReassignment cascade,
            ImpactAnalyzer impact,
            ReoptimizationPlanner planner,
            ScheduleSolver solver,
            ExecutorService solverExecutor,
            EventPublisher publisher,
            LiveOpsProperties props,
            Clock clock
    ) {
        return new TournamentRunnerFactory(
                lifecycle, conflicts, courtFill, cascade, impact, planner, solver,
                solverExecutor, props.solver().callTimeout(), publisher, clock);
    }
}
