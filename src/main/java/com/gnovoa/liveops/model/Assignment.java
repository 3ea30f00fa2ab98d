package com.gnovoa.liveops.model;

/**
 * Planned placement of a match: court and start slot, occupying
 * {@code [slotId, slotId + durationSlots)}.
 */
public record Assignment(String matchId, int courtId, int slotId, int durationSlots) {

    public Assignment {
        if (slotId < 0) throw new IllegalArgumentException("slotId must be >= 0 for " + matchId);
        if (durationSlots < 1) throw new IllegalArgumentException("durationSlots must be >= 1 for " + matchId);
    }

    public int endSlot() { return slotId + durationSlots; }

    public boolean overlaps(int fromSlot, int toSlot) {
        return slotId < toSlot && fromSlot < endSlot();
    }

    public Assignment movedTo(int newCourtId, int newSlotId) {
        return new Assignment(matchId, newCourtId, newSlotId, durationSlots);
    }
}
