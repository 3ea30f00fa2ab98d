package com.gnovoa.liveops.core;

public class NotFoundException extends LiveOpsException {

    public NotFoundException(String message) {
        super("not_found", message);
    }

    public static NotFoundException match(String matchId) {
        return new NotFoundException("Unknown match " + matchId);
    }

    public static NotFoundException assignment(String matchId) {
        return new NotFoundException("Match " + matchId + " has no assignment");
    }

    public static NotFoundException tournament(String tournamentId) {
        return new NotFoundException("Unknown tournament " + tournamentId);
    }
}
