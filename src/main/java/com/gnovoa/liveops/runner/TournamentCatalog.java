package com.gnovoa.liveops.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.liveops.core.InvalidTournamentException;
import com.gnovoa.liveops.model.Assignment;
import com.gnovoa.liveops.model.Match;
import com.gnovoa.liveops.model.Player;
import com.gnovoa.liveops.model.TournamentDocument;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads and validates tournament documents from the local filesystem.
 *
 * <p>Documents are configured via {@code liveops.tournaments.base-dir} and
 * {@code liveops.tournaments.files.*} and are expected to be JSON matching
 * {@link TournamentDocument}. The map key is the tournament id; it wins over any id in the file.
 */
@Component
public final class TournamentCatalog {

    private final ObjectMapper mapper;
    private final LiveOpsProperties.Tournaments props;

    public TournamentCatalog(ObjectMapper mapper, LiveOpsProperties props) {
        this.mapper = mapper;
        this.props = props.tournaments();
    }

    /**
     * Reads every configured document.
     *
     * @throws IllegalStateException if a file cannot be read or parsed
     * @throws InvalidTournamentException if a document breaks a structural rule
     */
    public List<TournamentDocument> loadConfigured() {
        Path baseDir = props.baseDir().toAbsolutePath().normalize();
        List<TournamentDocument> out = new ArrayList<>();
        for (Map.Entry<String, String> e : props.files().entrySet()) {
            Path p = baseDir.resolve(e.getValue()).normalize();
            TournamentDocument doc;
            try (var in = Files.newInputStream(p)) {
                doc = mapper.readValue(in, TournamentDocument.class);
            } catch (Exception ex) {
                throw new IllegalStateException("Failed to load tournament " + e.getKey() + " from " + p, ex);
            }
            doc = withId(doc, e.getKey());
            requireValid(doc);
            out.add(doc);
        }
        return out;
    }

    static TournamentDocument withId(TournamentDocument doc, String tournamentId) {
        if (tournamentId.equals(doc.tournamentId())) return doc;
        return new TournamentDocument(
                tournamentId, doc.config(), doc.players(), doc.matches(), doc.schedule(), doc.matchStates());
    }

    public static void requireValid(TournamentDocument doc) {
        List<String> problems = validate(doc);
        if (!problems.isEmpty()) throw new InvalidTournamentException(doc.tournamentId(), problems);
    }

    /**
     * Structural checks:
     *
     * <ul>
     *   <li>config present, ids present and unique for players and matches
     *   <li>match sides reference rostered players
     *   <li>at most one assignment per match, referencing a known match, on a court within
     *       {@code 1..courtCount}, with a duration matching the match
     *   <li>match states keyed by known match ids
     * </ul>
     *
     * @return human-readable problems, empty when valid
     */
    public static List<String> validate(TournamentDocument doc) {
        List<String> problems = new ArrayList<>();
        if (doc.tournamentId() == null || doc.tournamentId().isBlank()) problems.add("tournamentId is required");
        if (doc.config() == null) {
            problems.add("config is required");
            return problems;
        }

        Set<String> playerIds = new HashSet<>();
        for (Player p : doc.players()) {
            if (p.id() == null || p.id().isBlank()) problems.add("player without id");
            else if (!playerIds.add(p.id())) problems.add("duplicate player id " + p.id());
        }

        Set<String> matchIds = new HashSet<>();
        for (Match m : doc.matches()) {
            if (m.id() == null || m.id().isBlank()) {
                problems.add("match without id");
                continue;
            }
            if (!matchIds.add(m.id())) problems.add("duplicate match id " + m.id());
            for (String pid : m.playerIds()) {
                if (!playerIds.contains(pid)) problems.add("match " + m.id() + " references unknown player " + pid);
            }
        }

        Set<String> assigned = new HashSet<>();
        int courts = doc.config().courtCount();
        for (Assignment a : doc.schedule().assignments()) {
            if (!matchIds.contains(a.matchId())) problems.add("assignment for unknown match " + a.matchId());
            if (!assigned.add(a.matchId())) problems.add("more than one assignment for match " + a.matchId());
            if (a.courtId() < 1 || a.courtId() > courts) {
                problems.add("match " + a.matchId() + " assigned to court " + a.courtId() + " outside 1.." + courts);
            }
            doc.matches().stream()
                    .filter(m -> m.id() != null && m.id().equals(a.matchId()))
                    .findFirst()
                    .filter(m -> m.durationSlots() != a.durationSlots())
                    .ifPresent(m -> problems.add("match " + a.matchId() + " lasts " + m.durationSlots()
                            + " slot(s) but is assigned " + a.durationSlots()));
        }

        for (String id : doc.matchStates().keySet()) {
            if (!matchIds.contains(id)) problems.add("state for unknown match " + id);
        }
        return problems;
    }
}
