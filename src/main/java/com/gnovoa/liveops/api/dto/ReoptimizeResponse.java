package com.gnovoa.liveops.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gnovoa.liveops.model.Schedule;

import java.util.Map;

/**
 * @param state {@code RUNNING} when accepted asynchronously, {@code APPLIED} when the caller waited
 * @param schedule the committed schedule, only when the caller waited
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReoptimizeResponse(String tournamentId, String state, Schedule schedule, Map<String, String> ws) {}
