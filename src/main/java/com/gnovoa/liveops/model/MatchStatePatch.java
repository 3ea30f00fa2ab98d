package com.gnovoa.liveops.model;

import java.time.LocalTime;
import java.util.Map;

/**
 * Side-channel fields that may accompany a transition or be applied on their own.
 * Null fields are left untouched.
 */
public record MatchStatePatch(
    LocalTime actualStartTime,
    LocalTime actualEndTime,
    Integer actualCourtId,
    Boolean delayed,
    String delayReason,
    Boolean pinned,
    Boolean postponed,
    Map<String, Boolean> playerConfirmations,
    MatchScore score,
    String notes) {

    public static MatchStatePatch delay(String reason) {
        return new MatchStatePatch(null, null, null, true, reason, null, null, null, null, null);
    }

    public MatchState.Builder applyTo(MatchState.Builder b) {
        if (actualStartTime != null) b.actualStartTime(actualStartTime);
        if (actualEndTime != null) b.actualEndTime(actualEndTime);
        if (actualCourtId != null) b.actualCourtId(actualCourtId);
        if (delayed != null) b.delayed(delayed);
        if (delayReason != null) b.delayReason(delayReason);
        if (pinned != null) b.pinned(pinned);
        if (postponed != null) b.postponed(postponed);
        if (playerConfirmations != null) b.playerConfirmations(playerConfirmations);
        if (score != null) b.score(score);
        if (notes != null) b.notes(notes);
        return b;
    }
}
