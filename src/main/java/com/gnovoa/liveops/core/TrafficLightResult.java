package com.gnovoa.liveops.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * @param blockedBy ids of the called/started matches holding this match's players (red)
 * @param availableInSlots slots until every resting player is eligible (yellow)
 */
public record TrafficLightResult(
        TrafficLight status,
        String reason,
        List<String> blockedBy,
        List<String> playersBlocked,
        List<String> playersResting,
        Integer availableInSlots
) {
    public TrafficLightResult {
        blockedBy = blockedBy == null ? List.of() : List.copyOf(blockedBy);
        playersBlocked = playersBlocked == null ? List.of() : List.copyOf(playersBlocked);
        playersResting = playersResting == null ? List.of() : List.copyOf(playersResting);
    }

    public static TrafficLightResult green(String reason) {
        return new TrafficLightResult(TrafficLight.GREEN, reason, null, null, null, null);
    }

    @JsonIgnore
    public boolean isGreen() {
        return status == TrafficLight.GREEN;
    }
}
