package com.gnovoa.liveops.ws;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.*;

/**
 * Read-only push channels. Clients subscribe to a whole tournament or to one match of it; the
 * {@link WsRouter} keys sessions by the path they connected on.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    static final String TOURNAMENT_CHANNEL = "/ws/tournaments/*";
    static final String MATCH_CHANNEL = "/ws/tournaments/*/matches/*";

    private final WsRouter router;

    public WebSocketConfig(WsRouter router) {
        this.router = router;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(router, TOURNAMENT_CHANNEL, MATCH_CHANNEL)
                .setAllowedOrigins("*");
    }
}
