package com.gnovoa.liveops.model;

import java.util.List;
import java.util.Map;

/**
 * Export/import layout of a whole tournament. MatchStates are keyed by match id,
 * assignments live inside {@code schedule}.
 */
public record TournamentDocument(
    String tournamentId,
    TournamentConfig config,
    List<Player> players,
    List<Match> matches,
    Schedule schedule,
    Map<String, MatchState> matchStates) {

    public TournamentDocument {
        players = players == null ? List.of() : List.copyOf(players);
        matches = matches == null ? List.of() : List.copyOf(matches);
        if (schedule == null) schedule = Schedule.of(List.of());
        matchStates = matchStates == null ? Map.of() : Map.copyOf(matchStates);
    }
}
