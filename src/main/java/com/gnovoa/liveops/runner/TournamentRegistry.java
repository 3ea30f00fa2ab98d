package com.gnovoa.liveops.runner;

import com.gnovoa.liveops.core.NotFoundException;
import com.gnovoa.liveops.model.TournamentDocument;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public final class TournamentRegistry {

    private final Map<String, TournamentRunner> runners = new ConcurrentHashMap<>();
    private final TournamentRunnerFactory factory;

    public TournamentRegistry(TournamentRunnerFactory factory) {
        this.factory = factory;
    }

    public TournamentRunner runner(String tournamentId) {
        TournamentRunner r = runners.get(tournamentId);
        if (r == null) throw NotFoundException.tournament(tournamentId);
        return r;
    }

    /** Creates the tournament's runner, or replaces the tables of the existing one. */
    public TournamentRunner register(TournamentDocument document) {
        return runners.compute(document.tournamentId(), (id, existing) -> {
            if (existing == null) return factory.create(document);
            existing.replace(document);
            return existing;
        });
    }

    public List<String> tournamentIds() {
        return runners.keySet().stream().sorted().toList();
    }
}
