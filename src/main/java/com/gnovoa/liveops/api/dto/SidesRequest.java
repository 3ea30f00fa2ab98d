package com.gnovoa.liveops.api.dto;

import java.util.List;

public record SidesRequest(List<String> sideA, List<String> sideB) {}
