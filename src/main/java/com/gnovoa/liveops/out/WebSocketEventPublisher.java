package com.gnovoa.liveops.out;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.liveops.events.LiveOpsEvent;
import com.gnovoa.liveops.ws.WsRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Set;

/** Broadcasts events to the tournament channel and, for match events, the match channel. */
@Component
public final class WebSocketEventPublisher implements SyncTarget {

    private static final Logger log = LoggerFactory.getLogger(WebSocketEventPublisher.class);

    private final WsRouter router;
    private final ObjectMapper mapper;

    public WebSocketEventPublisher(WsRouter router, ObjectMapper mapper) {
        this.router = router;
        this.mapper = mapper;
    }

    @Override
    public String name() {
        return "websocket";
    }

    @Override
    public boolean accepts(LiveOpsEvent event) {
        return true;
    }

    @Override
    public void deliver(LiveOpsEvent event) {
        String json;
        try {
            json = mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + event.type(), e);
        }
        TextMessage msg = new TextMessage(json);
        log.debug("Publishing event: {} - {}", event.type(), json);

        send(router.forKey(WsRouter.tournamentKey(event.tournamentId())), msg);
        if (event.matchId() != null) {
            send(router.forKey(WsRouter.matchKey(event.tournamentId(), event.matchId())), msg);
        }
    }

    private static void send(Set<WebSocketSession> sessions, TextMessage msg) {
        for (WebSocketSession s : sessions) {
            if (!s.isOpen()) continue;
            try {
                // a session is not safe for concurrent sends
                synchronized (s) {
                    s.sendMessage(msg);
                }
            } catch (IOException e) {
                log.warn("Failed to push to session {}: {}", s.getId(), e.getMessage());
            }
        }
    }
}
