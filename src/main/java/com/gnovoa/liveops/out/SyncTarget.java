package com.gnovoa.liveops.out;

import com.gnovoa.liveops.events.LiveOpsEvent;

/** One downstream consumer of the outbox. A thrown exception makes the outbox retry. */
public interface SyncTarget {

    String name();

    boolean accepts(LiveOpsEvent event);

    void deliver(LiveOpsEvent event);
}
