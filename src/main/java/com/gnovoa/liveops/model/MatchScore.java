package com.gnovoa.liveops.model;

import java.util.List;

/** Final score with optional set-by-set detail. */
public record MatchScore(int sideA, int sideB, List<SetScore> sets) {

    public MatchScore {
        sets = sets == null ? List.of() : List.copyOf(sets);
    }

    public record SetScore(int sideA, int sideB) {}
}
