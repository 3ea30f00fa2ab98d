package com.gnovoa.liveops.runner;

public record TournamentStatus(
        String tournamentId,
        int total,
        int scheduled,
        int called,
        int started,
        int finished,
        int remaining,
        int percentComplete,
        int currentSlot,
        boolean reoptimizing
) {}
