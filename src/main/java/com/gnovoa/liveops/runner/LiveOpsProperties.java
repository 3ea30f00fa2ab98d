package com.gnovoa.liveops.runner;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

@ConfigurationProperties(prefix = "liveops")
public record LiveOpsProperties(
        Conflicts conflicts,
        Solver solver,
        Sync sync,
        Tournaments tournaments
) {

    public LiveOpsProperties {
        if (conflicts == null) conflicts = new Conflicts(null);
        if (solver == null) solver = new Solver(null, null, null, null, null);
        if (sync == null) sync = new Sync(null, null, null, null);
        if (tournaments == null) tournaments = new Tournaments(null, null, false);
    }

    /** @param calledBlocks players of a {@code called} match count as busy, not only {@code started} */
    public record Conflicts(Boolean calledBlocks) {
        public Conflicts {
            if (calledBlocks == null) calledBlocks = true;
        }
    }

    public record Solver(
            String baseUrl,
            Double timeLimitSeconds,
            Integer numWorkers,
            Duration timeoutMargin,
            Integer minFreezeHorizonSlots
    ) {
        public Solver {
            if (baseUrl == null || baseUrl.isBlank()) baseUrl = "http://localhost:8000";
            if (timeLimitSeconds == null) timeLimitSeconds = 5.0;
            if (numWorkers == null) numWorkers = 4;
            if (timeoutMargin == null) timeoutMargin = Duration.ofSeconds(10);
            if (minFreezeHorizonSlots == null) minFreezeHorizonSlots = 2;
        }

        /** Hard deadline for one solver call: the solver's own limit plus transport margin. */
        public Duration callTimeout() {
            return Duration.ofMillis(Math.round(timeLimitSeconds * 1000)).plus(timeoutMargin);
        }
    }

    /** @param remoteUrl base URL of the remote MatchState store; unset disables the mirror */
    public record Sync(Integer maxAttempts, Duration backoff, String remoteUrl, Integer queueCapacity) {
        public Sync {
            if (maxAttempts == null || maxAttempts < 1) maxAttempts = 3;
            if (backoff == null) backoff = Duration.ofMillis(500);
            if (queueCapacity == null || queueCapacity < 1) queueCapacity = 1000;
        }
    }

    /** @param files tournament id to JSON file name, resolved against {@code baseDir} */
    public record Tournaments(Path baseDir, Map<String, String> files, boolean loadOnBoot) {
        public Tournaments {
            if (baseDir == null) baseDir = Path.of("tournaments");
            files = files == null ? Map.of() : Map.copyOf(files);
        }
    }
}
