package com.gnovoa.liveops.core;

import java.util.List;

/**
 * Blast radius of one match running past its scheduled end.
 *
 * @param directlyImpacted scheduled matches sharing a player and starting at or after the actual end
 * @param cascadeImpacted scheduled matches sharing a player with a directly impacted one, later in the day
 */
public record ImpactAnalysis(
        String matchId,
        Integer matchNumber,
        int actualEndSlot,
        int scheduledEndSlot,
        int overrunSlots,
        List<String> directlyImpacted,
        List<String> cascadeImpacted,
        SuggestedAction suggestedAction
) {
    public ImpactAnalysis {
        directlyImpacted = List.copyOf(directlyImpacted);
        cascadeImpacted = List.copyOf(cascadeImpacted);
    }
}
