package com.gnovoa.liveops.core;

/**
 * A court with nothing started or called on it whose last match has finished.
 *
 * @param finishedEarly the last match finished before its scheduled end slot
 */
public record FreeCourt(
        int courtId,
        int freeAtSlot,
        String lastMatchId,
        String lastMatchLabel,
        boolean finishedEarly
) {}
