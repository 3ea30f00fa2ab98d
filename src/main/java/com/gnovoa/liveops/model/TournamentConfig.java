package com.gnovoa.liveops.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Tournament-wide timing and court configuration.
 *
 * @param intervalMinutes length of one slot
 * @param dayEnd end of play; a value at or before {@code dayStart} means the day runs overnight
 * @param freezeHorizonSlots slots from now the solver must leave untouched on re-solve
 */
public record TournamentConfig(
    int intervalMinutes,
    LocalTime dayStart,
    LocalTime dayEnd,
    LocalDate tournamentDate,
    List<BreakWindow> breaks,
    int courtCount,
    int defaultRestMinutes,
    int freezeHorizonSlots) {

    public TournamentConfig {
        if (intervalMinutes < 1) throw new IllegalArgumentException("intervalMinutes must be >= 1");
        if (courtCount < 1) throw new IllegalArgumentException("courtCount must be >= 1");
        if (dayStart == null) dayStart = LocalTime.of(9, 0);
        if (dayEnd == null) dayEnd = LocalTime.of(18, 0);
        breaks = breaks == null ? List.of() : List.copyOf(breaks);
        if (defaultRestMinutes < 0) defaultRestMinutes = 0;
        if (freezeHorizonSlots < 0) freezeHorizonSlots = 0;
    }
}
