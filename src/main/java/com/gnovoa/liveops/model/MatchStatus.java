package com.gnovoa.liveops.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Live lifecycle of a match.
 *
 * <pre>
 *   scheduled → called → started → finished
 *       ↓         ↓         ↓          ↓
 *    (delay)   (undo)    (undo)     (undo)
 *       ↓         ↓         ↓          ↓
 *   scheduled  scheduled  called    started
 * </pre>
 */
public enum MatchStatus {
    @JsonProperty("scheduled") SCHEDULED,
    @JsonProperty("called") CALLED,
    @JsonProperty("started") STARTED,
    @JsonProperty("finished") FINISHED;

    /** Statuses reachable from this one through a regular transition. */
    public Set<MatchStatus> validNext() {
        return switch (this) {
            case SCHEDULED -> EnumSet.of(CALLED, SCHEDULED);
            case CALLED -> EnumSet.of(STARTED, SCHEDULED);
            case STARTED -> EnumSet.of(FINISHED, CALLED);
            case FINISHED -> EnumSet.of(STARTED);
        };
    }

    /** Target of the undo path; empty for {@link #SCHEDULED}. */
    public Optional<MatchStatus> undoTarget() {
        return switch (this) {
            case SCHEDULED -> Optional.empty();
            case CALLED -> Optional.of(SCHEDULED);
            case STARTED -> Optional.of(CALLED);
            case FINISHED -> Optional.of(STARTED);
        };
    }

    public boolean canMoveTo(MatchStatus next) {
        return validNext().contains(next);
    }

    /** Started or finished work is committed and never displaced. */
    public boolean isCommitted() {
        return this == STARTED || this == FINISHED;
    }
}
