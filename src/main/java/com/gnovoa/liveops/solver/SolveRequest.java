package com.gnovoa.liveops.solver;

import java.util.List;

/** Body of {@code POST /schedule}. */
public record SolveRequest(
        Config config,
        List<PlayerInput> players,
        List<MatchInput> matches,
        List<PreviousAssignment> previousAssignments,
        Options solverOptions
) {

    public record Config(
            int totalSlots,
            int courtCount,
            int intervalMinutes,
            int defaultRestSlots,
            int freezeHorizonSlots,
            int currentSlot
    ) {}

    /** @param availability half-open {@code [startSlot, endSlot]} pairs; empty means always available */
    public record PlayerInput(String id, String name, List<List<Integer>> availability, int restSlots) {}

    public record MatchInput(String id, String eventCode, int durationSlots, List<String> sideA, List<String> sideB) {}

    /**
     * Placement hint. {@code locked} entries must not move; pinned ones name the slot and court
     * the solver has to keep.
     */
    public record PreviousAssignment(
            String matchId,
            int slotId,
            int courtId,
            boolean locked,
            Integer pinnedSlotId,
            Integer pinnedCourtId
    ) {}

    public record Options(double timeLimitSeconds, int numWorkers) {}
}
