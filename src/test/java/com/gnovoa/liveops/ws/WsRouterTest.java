package com.gnovoa.liveops.ws;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WsRouterTest {

    @Test
    void tournamentPathMapsToTournamentKey() {
        assertThat(WsRouter.routeKey("/ws/tournaments/club-open")).isEqualTo("tournament:club-open");
    }

    @Test
    void matchPathMapsToMatchKey() {
        assertThat(WsRouter.routeKey("/ws/tournaments/club-open/matches/m3")).isEqualTo("match:club-open:m3");
    }

    @Test
    void anythingElseIsUnknown() {
        assertThat(WsRouter.routeKey("/ws/other")).isEqualTo("unknown");
        assertThat(WsRouter.routeKey("")).isEqualTo("unknown");
    }
}
