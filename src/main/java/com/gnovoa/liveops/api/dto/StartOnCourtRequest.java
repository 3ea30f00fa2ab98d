package com.gnovoa.liveops.api.dto;

public record StartOnCourtRequest(int courtId) {}
