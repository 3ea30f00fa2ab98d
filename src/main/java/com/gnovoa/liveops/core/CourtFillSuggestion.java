package com.gnovoa.liveops.core;

import java.time.LocalTime;

/**
 * Proposal to call {@code suggestedMatchId} on an idle court. The original court, slot and time
 * are carried for the operator's context.
 */
public record CourtFillSuggestion(
        int courtId,
        String suggestedMatchId,
        String matchLabel,
        String players,
        int originalCourtId,
        int originalSlotId,
        LocalTime originalTime,
        String reason
) {}
