package com.gnovoa.liveops.core;

public class TargetOccupiedException extends LiveOpsException {

    public TargetOccupiedException(int courtId, String occupyingMatchId) {
        super("target_occupied", "Court " + courtId + " is occupied by started match " + occupyingMatchId);
    }
}
