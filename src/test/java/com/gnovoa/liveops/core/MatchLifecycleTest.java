package com.gnovoa.liveops.core;

import com.gnovoa.liveops.TestTournament;
import com.gnovoa.liveops.model.MatchScore;
import com.gnovoa.liveops.model.MatchState;
import com.gnovoa.liveops.model.MatchStatePatch;
import com.gnovoa.liveops.model.MatchStatus;
import com.gnovoa.liveops.model.TournamentState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.LocalTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchLifecycleTest {

    private final MatchLifecycle lifecycle = new MatchLifecycle(TestTournament.clockAtSlot(2));

    private TournamentState withStatus(MatchStatus status) {
        return TestTournament.withCourts(1)
                .match("M1", List.of("P1"), List.of("P2"), 1, 0, 2)
                .status("M1", status)
                .build();
    }

    @ParameterizedTest
    @EnumSource(MatchStatus.class)
    void transitionSucceedsExactlyForValidNextStatuses(MatchStatus from) {
        for (MatchStatus to : MatchStatus.values()) {
            TournamentState state = withStatus(from);
            if (from.validNext().contains(to)) {
                assertThat(lifecycle.transition(state, "M1", to, null).status()).isEqualTo(to);
            } else {
                assertThatThrownBy(() -> lifecycle.transition(state, "M1", to, null))
                        .isInstanceOf(InvalidTransitionException.class)
                        .hasMessageContaining(from.name().toLowerCase())
                        .hasMessageContaining(to.name().toLowerCase());
            }
        }
    }

    @Test
    void validNextTable() {
        assertThat(MatchStatus.SCHEDULED.validNext()).isEqualTo(EnumSet.of(MatchStatus.CALLED, MatchStatus.SCHEDULED));
        assertThat(MatchStatus.CALLED.validNext()).isEqualTo(EnumSet.of(MatchStatus.STARTED, MatchStatus.SCHEDULED));
        assertThat(MatchStatus.STARTED.validNext()).isEqualTo(EnumSet.of(MatchStatus.FINISHED, MatchStatus.CALLED));
        assertThat(MatchStatus.FINISHED.validNext()).isEqualTo(EnumSet.of(MatchStatus.STARTED));
    }

    @Test
    void startingStampsStartTimeFromClock() {
        MatchState s = lifecycle.transition(withStatus(MatchStatus.CALLED), "M1", MatchStatus.STARTED, null);

        assertThat(s.actualStartTime()).isEqualTo(LocalTime.of(10, 0));
        assertThat(s.updatedAt()).isNotNull();
    }

    @Test
    void explicitStartTimeWins() {
        MatchStatePatch patch = new MatchStatePatch(LocalTime.of(9, 47), null, null, null, null, null, null, null, null, null);

        MatchState s = lifecycle.transition(withStatus(MatchStatus.CALLED), "M1", MatchStatus.STARTED, patch);

        assertThat(s.actualStartTime()).isEqualTo(LocalTime.of(9, 47));
    }

    @Test
    void finishingStampsEndTime() {
        MatchState s = lifecycle.transition(withStatus(MatchStatus.STARTED), "M1", MatchStatus.FINISHED, null);

        assertThat(s.actualEndTime()).isEqualTo(LocalTime.of(10, 0));
    }

    @Test
    void undoFollowsTheUndoPath() {
        assertThat(lifecycle.undo(withStatus(MatchStatus.FINISHED), "M1").status()).isEqualTo(MatchStatus.STARTED);
        assertThat(lifecycle.undo(withStatus(MatchStatus.STARTED), "M1").status()).isEqualTo(MatchStatus.CALLED);
        assertThat(lifecycle.undo(withStatus(MatchStatus.CALLED), "M1").status()).isEqualTo(MatchStatus.SCHEDULED);
    }

    @Test
    void undoingStartClearsStartTime() {
        MatchState started = lifecycle.transition(withStatus(MatchStatus.CALLED), "M1", MatchStatus.STARTED, null);
        TournamentState state = withStatus(MatchStatus.CALLED).withMatchState(started);
        assertThat(started.actualStartTime()).isNotNull();

        MatchState undone = lifecycle.undo(state, "M1");

        assertThat(undone.status()).isEqualTo(MatchStatus.CALLED);
        assertThat(undone.actualStartTime()).isNull();
    }

    @Test
    void undoFromScheduledIsRejected() {
        assertThatThrownBy(() -> lifecycle.undo(withStatus(MatchStatus.SCHEDULED), "M1"))
                .isInstanceOf(InvalidTransitionException.class)
                .extracting(e -> ((LiveOpsException) e).code())
                .isEqualTo("invalid_transition");
    }

    @Test
    void undoingFinishClearsEndTimeAndScore() {
        TournamentState state = withStatus(MatchStatus.STARTED);
        MatchStatePatch scored = new MatchStatePatch(
                null, null, null, null, null, null, null, null, new MatchScore(21, 15, List.of()), null);
        MatchState finished = lifecycle.transition(state, "M1", MatchStatus.FINISHED, scored);

        MatchState undone = lifecycle.undo(state.withMatchState(finished), "M1");

        assertThat(undone.status()).isEqualTo(MatchStatus.STARTED);
        assertThat(undone.actualEndTime()).isNull();
        assertThat(undone.score()).isNull();
        assertThat(undone.actualStartTime()).isEqualTo(finished.actualStartTime());
    }

    @Test
    void leavingCalledClearsConfirmations() {
        TournamentState state = withStatus(MatchStatus.CALLED);
        MatchState confirmed = lifecycle.patch(state, "M1",
                new MatchStatePatch(null, null, null, null, null, null, null, Map.of("P1", true), null, null));
        assertThat(confirmed.playerConfirmations()).containsEntry("P1", true);

        MatchState back = lifecycle.transition(state.withMatchState(confirmed), "M1", MatchStatus.SCHEDULED, null);

        assertThat(back.playerConfirmations()).isEmpty();
    }

    @Test
    void patchKeepsStatus() {
        MatchState s = lifecycle.patch(withStatus(MatchStatus.SCHEDULED), "M1", MatchStatePatch.delay("Player late"));

        assertThat(s.status()).isEqualTo(MatchStatus.SCHEDULED);
        assertThat(s.delayed()).isTrue();
        assertThat(s.delayReason()).isEqualTo("Player late");
    }

    @Test
    void unknownMatchIsNotFound() {
        assertThatThrownBy(() -> lifecycle.transition(withStatus(MatchStatus.SCHEDULED), "nope", MatchStatus.CALLED, null))
                .isInstanceOf(NotFoundException.class);
    }
}
