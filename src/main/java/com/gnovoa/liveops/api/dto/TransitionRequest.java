package com.gnovoa.liveops.api.dto;

import com.gnovoa.liveops.model.MatchStatePatch;
import com.gnovoa.liveops.model.MatchStatus;

public record TransitionRequest(MatchStatus status, MatchStatePatch patch) {
    public TransitionRequest {
        if (status == null) throw new IllegalArgumentException("status is required");
    }
}
