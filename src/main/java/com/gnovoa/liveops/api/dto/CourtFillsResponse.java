package com.gnovoa.liveops.api.dto;

import com.gnovoa.liveops.core.CourtFillSuggestion;

import java.util.List;

public record CourtFillsResponse(String tournamentId, int slot, List<CourtFillSuggestion> suggestions) {}
