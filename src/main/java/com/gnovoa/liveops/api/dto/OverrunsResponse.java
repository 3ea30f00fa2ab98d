package com.gnovoa.liveops.api.dto;

import com.gnovoa.liveops.model.Assignment;

import java.util.List;

/** @param impacted scheduled matches sharing a player with any overrun, starting after it ended */
public record OverrunsResponse(String tournamentId, List<Assignment> overruns, List<Assignment> impacted) {}
