package com.gnovoa.liveops.core;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Availability of one player with respect to a given match.
 *
 * @param matchId the match keeping the player busy or resting, if any
 */
public record PlayerStatus(
        String playerId,
        String playerName,
        Availability availability,
        String reason,
        String matchId,
        Integer availableAtSlot
) {
    public enum Availability {
        @JsonProperty("available") AVAILABLE,
        @JsonProperty("active") ACTIVE,
        @JsonProperty("resting") RESTING
    }
}
