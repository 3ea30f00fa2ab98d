package com.gnovoa.liveops.out;

import com.gnovoa.liveops.events.LiveOpsEvent;
import com.gnovoa.liveops.events.LiveOpsEventType;
import com.gnovoa.liveops.model.MatchState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SyncOutboxTest {

    private static final Instant AT = Instant.parse("2026-10-17T09:00:00Z");

    private static LiveOpsEvent stateEvent() {
        return LiveOpsEvent.matchStateChanged("t-1", MatchState.initial("M1"), AT);
    }

    private static SyncTarget target(String name, boolean accepts) {
        SyncTarget target = mock(SyncTarget.class);
        when(target.name()).thenReturn(name);
        when(target.accepts(any())).thenReturn(accepts);
        return target;
    }

    @Test
    void deliversToEveryInterestedTarget() throws Exception {
        SyncTarget ws = target("websocket", true);
        SyncTarget mirror = target("remote-mirror", false);
        SyncOutbox outbox = new SyncOutbox(List.of(ws, mirror), 3, Duration.ZERO, 10);
        LiveOpsEvent event = stateEvent();

        outbox.dispatch(event);

        verify(ws).deliver(event);
        verify(mirror, never()).deliver(any());
    }

    @Test
    void failingTargetIsRetriedUpToTheLimit() throws Exception {
        SyncTarget flaky = target("remote-mirror", true);
        SyncTarget ws = target("websocket", true);
        doThrow(new IllegalStateException("503")).when(flaky).deliver(any());
        SyncOutbox outbox = new SyncOutbox(List.of(flaky, ws), 3, Duration.ZERO, 10);
        LiveOpsEvent event = stateEvent();

        outbox.dispatch(event);

        verify(flaky, times(3)).deliver(event);
        verify(ws).deliver(event);
    }

    @Test
    void recoveringTargetStopsRetrying() throws Exception {
        SyncTarget flaky = target("remote-mirror", true);
        doThrow(new IllegalStateException("503")).doNothing().when(flaky).deliver(any());
        SyncOutbox outbox = new SyncOutbox(List.of(flaky), 5, Duration.ZERO, 10);

        outbox.dispatch(stateEvent());

        verify(flaky, times(2)).deliver(any());
    }

    @Test
    void fullQueueDropsInsteadOfBlocking() {
        SyncOutbox outbox = new SyncOutbox(List.of(), 1, Duration.ZERO, 1);

        outbox.publish(stateEvent());
        outbox.publish(LiveOpsEvent.reoptimized("t-1", List.of(), AT));

        assertThat(outbox.pending()).isEqualTo(1);
    }

    @Test
    void startedOutboxDrainsTheQueue() {
        SyncTarget ws = target("websocket", true);
        SyncOutbox outbox = new SyncOutbox(List.of(ws), 1, Duration.ZERO, 10);
        outbox.start();
        try {
            outbox.publish(stateEvent());

            verify(ws, timeout(2000)).deliver(
                    argThat(e -> e.type() == LiveOpsEventType.MATCH_STATE_CHANGED));
            assertThat(outbox.pending()).isZero();
        } finally {
            outbox.stop();
        }
    }
}
