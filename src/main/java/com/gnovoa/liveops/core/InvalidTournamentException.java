package com.gnovoa.liveops.core;

import java.util.List;

/** An imported tournament document breaks a structural rule; nothing was loaded. */
public class InvalidTournamentException extends LiveOpsException {

    private final List<String> problems;

    public InvalidTournamentException(String tournamentId, List<String> problems) {
        super("invalid_tournament", "Tournament " + tournamentId + " is invalid: " + problems.size() + " problem(s)");
        this.problems = List.copyOf(problems);
    }

    @Override
    public List<String> details() {
        return problems;
    }
}
