package com.gnovoa.liveops.model;

import java.time.LocalTime;

public record BreakWindow(LocalTime start, LocalTime end) {}
