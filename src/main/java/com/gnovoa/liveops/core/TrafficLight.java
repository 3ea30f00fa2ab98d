package com.gnovoa.liveops.core;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Readiness verdict for calling a match. Red dominates yellow dominates green. */
public enum TrafficLight {
    @JsonProperty("green") GREEN,
    @JsonProperty("yellow") YELLOW,
    @JsonProperty("red") RED
}
