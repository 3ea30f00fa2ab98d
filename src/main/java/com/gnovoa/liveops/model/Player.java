package com.gnovoa.liveops.model;

import java.util.List;
import java.util.Set;

/**
 * A rostered player.
 *
 * @param minRestMinutes optional override of the tournament's default rest
 */
public record Player(
    String id,
    String name,
    String groupId,
    Set<String> ranks,
    List<AvailabilityWindow> availability,
    Integer minRestMinutes) {

    public Player {
        ranks = ranks == null ? Set.of() : Set.copyOf(ranks);
        availability = availability == null ? List.of() : List.copyOf(availability);
    }

    public int restMinutes(TournamentConfig config) {
        return minRestMinutes != null ? minRestMinutes : config.defaultRestMinutes();
    }
}
