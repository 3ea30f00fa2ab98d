package com.gnovoa.liveops.api.dto;

import com.gnovoa.liveops.runner.TournamentStatus;

import java.util.Map;

public record TournamentStatusResponse(TournamentStatus status, Map<String, String> ws) {}
