package com.gnovoa.liveops.core;

public class ReoptimizeInProgressException extends LiveOpsException {

    public ReoptimizeInProgressException(String tournamentId) {
        super("reoptimize_in_progress", "A re-optimization is already running for tournament " + tournamentId);
    }
}
