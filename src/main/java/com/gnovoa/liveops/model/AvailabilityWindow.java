package com.gnovoa.liveops.model;

import java.time.LocalTime;

public record AvailabilityWindow(LocalTime start, LocalTime end) {}
