package com.gnovoa.liveops.api.dto;

import com.gnovoa.liveops.core.TrafficLightResult;

import java.util.Map;

public record ConflictsResponse(String tournamentId, int slot, Map<String, TrafficLightResult> matches) {}
