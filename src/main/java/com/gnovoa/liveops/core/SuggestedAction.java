package com.gnovoa.liveops.core;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Corrective action recommended for an overrunning match. */
public enum SuggestedAction {
    @JsonProperty("none") NONE,
    @JsonProperty("wait") WAIT,
    @JsonProperty("manual_adjust") MANUAL_ADJUST,
    @JsonProperty("reoptimize") REOPTIMIZE;

    static SuggestedAction forImpact(int overrunSlots, int directlyImpacted) {
        if (overrunSlots <= 0) return NONE;
        if (directlyImpacted == 0) return WAIT;
        if (directlyImpacted <= 2) return MANUAL_ADJUST;
        return REOPTIMIZE;
    }
}
