package com.gnovoa.liveops.model;

import java.time.Instant;
import java.time.LocalTime;
import java.util.Map;

/**
 * Live status and annotations of one match, kept apart from its planned {@link Assignment}.
 *
 * <p>Instances are immutable; every change produces a new value through {@link #toBuilder()}.
 * {@code originalSlotId} and {@code originalCourtId} record where the match sat before it was
 * displaced by a court reassignment. They are always set and cleared together.
 *
 * @param actualCourtId court the match is really played on when it differs from the plan
 * @param pinned exempt from automatic displacement and solver movement
 * @param playerConfirmations player id to "present at court", meaningful only while called
 */
public record MatchState(
    String matchId,
    MatchStatus status,
    LocalTime actualStartTime,
    LocalTime actualEndTime,
    Integer actualCourtId,
    boolean delayed,
    String delayReason,
    boolean pinned,
    boolean postponed,
    Map<String, Boolean> playerConfirmations,
    MatchScore score,
    String notes,
    Integer originalSlotId,
    Integer originalCourtId,
    Instant updatedAt) {

    public MatchState {
        if (status == null) status = MatchStatus.SCHEDULED;
        playerConfirmations = playerConfirmations == null ? Map.of() : Map.copyOf(playerConfirmations);
        if ((originalSlotId == null) != (originalCourtId == null)) {
            throw new IllegalArgumentException(
                    "originalSlotId and originalCourtId must be set together for " + matchId);
        }
    }

    /** Default state of a match nobody has touched yet. */
    public static MatchState initial(String matchId) {
        return new Builder(matchId).build();
    }

    public boolean hasOriginalPosition() {
        return originalSlotId != null;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {
        private final String matchId;
        private MatchStatus status = MatchStatus.SCHEDULED;
        private LocalTime actualStartTime;
        private LocalTime actualEndTime;
        private Integer actualCourtId;
        private boolean delayed;
        private String delayReason;
        private boolean pinned;
        private boolean postponed;
        private Map<String, Boolean> playerConfirmations = Map.of();
        private MatchScore score;
        private String notes;
        private Integer originalSlotId;
        private Integer originalCourtId;
        private Instant updatedAt;

        private Builder(String matchId) {
            this.matchId = matchId;
        }

        private Builder(MatchState s) {
            this.matchId = s.matchId;
            this.status = s.status;
            this.actualStartTime = s.actualStartTime;
            this.actualEndTime = s.actualEndTime;
            this.actualCourtId = s.actualCourtId;
            this.delayed = s.delayed;
            this.delayReason = s.delayReason;
            this.pinned = s.pinned;
            this.postponed = s.postponed;
            this.playerConfirmations = s.playerConfirmations;
            this.score = s.score;
            this.notes = s.notes;
            this.originalSlotId = s.originalSlotId;
            this.originalCourtId = s.originalCourtId;
            this.updatedAt = s.updatedAt;
        }

        public Builder status(MatchStatus v) { this.status = v; return this; }
        public Builder actualStartTime(LocalTime v) { this.actualStartTime = v; return this; }
        public Builder actualEndTime(LocalTime v) { this.actualEndTime = v; return this; }
        public Builder actualCourtId(Integer v) { this.actualCourtId = v; return this; }
        public Builder delayed(boolean v) { this.delayed = v; return this; }
        public Builder delayReason(String v) { this.delayReason = v; return this; }
        public Builder pinned(boolean v) { this.pinned = v; return this; }
        public Builder postponed(boolean v) { this.postponed = v; return this; }
        public Builder playerConfirmations(Map<String, Boolean> v) { this.playerConfirmations = v; return this; }
        public Builder score(MatchScore v) { this.score = v; return this; }
        public Builder notes(String v) { this.notes = v; return this; }
        public Builder updatedAt(Instant v) { this.updatedAt = v; return this; }

        public Builder originalPosition(int slotId, int courtId) {
            this.originalSlotId = slotId;
            this.originalCourtId = courtId;
            return this;
        }

        public Builder clearOriginalPosition() {
            this.originalSlotId = null;
            this.originalCourtId = null;
            return this;
        }

        public MatchState build() {
            return new MatchState(
                    matchId,
                    status,
                    actualStartTime,
                    actualEndTime,
                    actualCourtId,
                    delayed,
                    delayReason,
                    pinned,
                    postponed,
                    playerConfirmations,
                    score,
                    notes,
                    originalSlotId,
                    originalCourtId,
                    updatedAt
            );
        }
    }
}
