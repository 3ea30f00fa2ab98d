package com.gnovoa.liveops.out;

import com.gnovoa.liveops.events.LiveOpsEvent;
import com.gnovoa.liveops.events.LiveOpsEventType;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/**
 * Mirrors MatchState writes to a remote store with {@code PUT /match-states/{matchId}}.
 * Local state stays authoritative; failures surface to the outbox for retry.
 */
public final class RemoteMatchStateMirror implements SyncTarget {

    private final RestClient restClient;

    public RemoteMatchStateMirror(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public String name() {
        return "remote-mirror";
    }

    @Override
    public boolean accepts(LiveOpsEvent event) {
        return event.type() == LiveOpsEventType.MATCH_STATE_CHANGED && event.matchState() != null;
    }

    @Override
    public void deliver(LiveOpsEvent event) {
        restClient.put()
                .uri("/match-states/{matchId}", event.matchId())
                .contentType(MediaType.APPLICATION_JSON)
                .body(event.matchState())
                .retrieve()
                .toBodilessEntity();
    }
}
