package com.gnovoa.liveops.core;

import com.gnovoa.liveops.model.TournamentConfig;

import java.time.Clock;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;

/**
 * Converts between wall-clock times and schedule slots for one tournament day.
 *
 * <p>When {@code dayEnd} is at or before {@code dayStart} the day runs overnight, and times
 * earlier than {@code dayStart} belong to the following calendar day.
 */
public final class SlotClock {

    private static final int MINUTES_PER_DAY = 24 * 60;

    private final int startMinutes;
    private final int endMinutes;
    private final int intervalMinutes;
    private final boolean overnight;

    public SlotClock(TournamentConfig config) {
        this.startMinutes = minutesOf(config.dayStart());
        this.endMinutes = minutesOf(config.dayEnd());
        this.intervalMinutes = config.intervalMinutes();
        this.overnight = endMinutes <= startMinutes;
    }

    /** Slot containing {@code time}; negative before the day starts. */
    public int timeToSlot(LocalTime time) {
        int t = minutesOf(time);
        if (overnight && t < startMinutes) t += MINUTES_PER_DAY;
        return Math.floorDiv(t - startMinutes, intervalMinutes);
    }

    public LocalTime slotToTime(int slot) {
        int minutes = Math.floorMod(startMinutes + slot * intervalMinutes, MINUTES_PER_DAY);
        return LocalTime.of(minutes / 60, minutes % 60);
    }

    /** Current slot, never below zero. */
    public int currentSlot(Clock clock) {
        return Math.max(0, timeToSlot(LocalTime.now(clock)));
    }

    public int totalSlots() {
        int span = overnight ? endMinutes + MINUTES_PER_DAY - startMinutes : endMinutes - startMinutes;
        return Math.max(1, span / intervalMinutes);
    }

    /** Rest requirement in whole slots, rounded up. */
    public int minutesToSlots(int minutes) {
        return (minutes + intervalMinutes - 1) / intervalMinutes;
    }

    public int slotsToMinutes(int slots) {
        return slots * intervalMinutes;
    }

    /** Wall-clock time now, truncated to the minute. */
    public static LocalTime now(Clock clock) {
        return LocalTime.now(clock).truncatedTo(ChronoUnit.MINUTES);
    }

    private static int minutesOf(LocalTime t) {
        return t.getHour() * 60 + t.getMinute();
    }
}
