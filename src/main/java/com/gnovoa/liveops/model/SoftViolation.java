package com.gnovoa.liveops.model;

public record SoftViolation(
    String type,
    String matchId,
    String playerId,
    String description,
    double penaltyIncurred) {}
