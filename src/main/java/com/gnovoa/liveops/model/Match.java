package com.gnovoa.liveops.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A match to be played. Side lists may be edited live (substitution, withdrawal).
 */
public record Match(
    String id,
    Integer matchNumber,
    String eventRank,
    List<String> sideA,
    List<String> sideB,
    int durationSlots,
    Integer preferredCourtId) {

    public Match {
        sideA = sideA == null ? List.of() : List.copyOf(sideA);
        sideB = sideB == null ? List.of() : List.copyOf(sideB);
        if (durationSlots < 1) durationSlots = 1;
    }

    /** Display label: event rank, else "M" + number. */
    public String label() {
        if (eventRank != null && !eventRank.isBlank()) return eventRank;
        return "M" + (matchNumber == null ? "?" : matchNumber);
    }

    public List<String> playerIds() {
        List<String> ids = new ArrayList<>(sideA.size() + sideB.size());
        ids.addAll(sideA);
        ids.addAll(sideB);
        return ids;
    }

    public Match withSides(List<String> newSideA, List<String> newSideB) {
        return new Match(id, matchNumber, eventRank, newSideA, newSideB, durationSlots, preferredCourtId);
    }
}
