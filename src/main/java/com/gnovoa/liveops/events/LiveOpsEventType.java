package com.gnovoa.liveops.events;

public enum LiveOpsEventType {
    MATCH_STATE_CHANGED,
    SCHEDULE_CHANGED,
    REOPTIMIZED,
    REOPTIMIZE_FAILED
}
