package com.gnovoa.liveops.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Consistent, immutable view of one tournament: configuration, roster, matches, the
 * Assignment table and the MatchState table.
 *
 * <p>The runner owning a tournament publishes a new instance for every committed command, so
 * readers (conflict evaluation, court fill, impact analysis) always work against a snapshot that
 * cannot change underneath them.
 */
public final class TournamentState {

    private final String tournamentId;
    private final TournamentConfig config;
    private final List<Player> players;
    private final List<Match> matches;
    private final Schedule schedule;
    private final Map<String, MatchState> matchStates;

    private final Map<String, Player> playersById;
    private final Map<String, Match> matchesById;
    private final Map<String, Assignment> assignmentsById;

    public TournamentState(
            String tournamentId,
            TournamentConfig config,
            List<Player> players,
            List<Match> matches,
            Schedule schedule,
            Map<String, MatchState> matchStates
    ) {
        this.tournamentId = tournamentId;
        this.config = config;
        this.players = List.copyOf(players);
        this.matches = List.copyOf(matches);
        this.schedule = schedule;
        this.matchStates = Collections.unmodifiableMap(new LinkedHashMap<>(matchStates));
        this.playersById = index(this.players, Player::id);
        this.matchesById = index(this.matches, Match::id);
        this.assignmentsById = index(schedule.assignments(), Assignment::matchId);
    }

    public static TournamentState fromDocument(TournamentDocument doc) {
        return new TournamentState(
                doc.tournamentId(), doc.config(), doc.players(), doc.matches(), doc.schedule(), doc.matchStates());
    }

    public TournamentDocument toDocument() {
        return new TournamentDocument(tournamentId, config, players, matches, schedule, matchStates);
    }

    public String tournamentId() { return tournamentId; }
    public TournamentConfig config() { return config; }
    public List<Player> players() { return players; }
    public List<Match> matches() { return matches; }
    public Schedule schedule() { return schedule; }
    public List<Assignment> assignments() { return schedule.assignments(); }

    /** Recorded states only; use {@link #stateOf(String)} for the lazy default. */
    public Map<String, MatchState> matchStates() { return matchStates; }

    /** State of the match, defaulting to {@code scheduled} when nothing was recorded yet. */
    public MatchState stateOf(String matchId) {
        MatchState s = matchStates.get(matchId);
        return s != null ? s : MatchState.initial(matchId);
    }

    public MatchStatus statusOf(String matchId) {
        return stateOf(matchId).status();
    }

    public Optional<Match> match(String matchId) { return Optional.ofNullable(matchesById.get(matchId)); }
    public Optional<Player> player(String playerId) { return Optional.ofNullable(playersById.get(playerId)); }
    public Optional<Assignment> assignment(String matchId) { return Optional.ofNullable(assignmentsById.get(matchId)); }

    public String playerName(String playerId) {
        return player(playerId).map(Player::name).orElse(playerId);
    }

    public String matchLabel(String matchId) {
        return match(matchId).map(Match::label).orElse(matchId);
    }

    public List<String> playerIdsOf(String matchId) {
        return match(matchId).map(Match::playerIds).orElse(List.of());
    }

    public List<Assignment> assignmentsOnCourt(int courtId) {
        return assignments().stream().filter(a -> a.courtId() == courtId).toList();
    }

    public TournamentState withSchedule(Schedule newSchedule) {
        return new TournamentState(tournamentId, config, players, matches, newSchedule, matchStates);
    }

    public TournamentState withAssignments(List<Assignment> newAssignments) {
        return withSchedule(schedule.withAssignments(newAssignments));
    }

    public TournamentState withMatchStates(Map<String, MatchState> newStates) {
        return new TournamentState(tournamentId, config, players, matches, schedule, newStates);
    }

    public TournamentState withMatchState(MatchState state) {
        Map<String, MatchState> copy = new LinkedHashMap<>(matchStates);
        copy.put(state.matchId(), state);
        return withMatchStates(copy);
    }

    public TournamentState withMatch(Match match) {
        List<Match> copy = matches.stream().map(m -> m.id().equals(match.id()) ? match : m).toList();
        return new TournamentState(tournamentId, config, players, copy, schedule, matchStates);
    }

    private static <T> Map<String, T> index(List<T> items, Function<T, String> key) {
        return items.stream().collect(Collectors.toUnmodifiableMap(key, Function.identity(), (a, b) -> a));
    }
}
