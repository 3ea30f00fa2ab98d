package com.gnovoa.liveops.out;

import com.gnovoa.liveops.events.LiveOpsEvent;

/** Accepts committed-change events without blocking the caller. */
public interface EventPublisher {

    void publish(LiveOpsEvent event);
}
