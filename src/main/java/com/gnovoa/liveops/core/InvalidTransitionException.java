package com.gnovoa.liveops.core;

import com.gnovoa.liveops.model.MatchStatus;

public class InvalidTransitionException extends LiveOpsException {

    private final MatchStatus from;
    private final MatchStatus to;

    public InvalidTransitionException(String matchId, MatchStatus from, MatchStatus to) {
        super("invalid_transition",
                "Invalid state transition for match " + matchId + ": cannot go from '"
                        + from.name().toLowerCase() + "' to '" + to.name().toLowerCase() + "'");
        this.from = from;
        this.to = to;
    }

    public InvalidTransitionException(String matchId, MatchStatus from) {
        super("invalid_transition",
                "Match " + matchId + " cannot be undone from '" + from.name().toLowerCase() + "'");
        this.from = from;
        this.to = null;
    }

    public MatchStatus from() { return from; }
    public MatchStatus to() { return to; }
}
