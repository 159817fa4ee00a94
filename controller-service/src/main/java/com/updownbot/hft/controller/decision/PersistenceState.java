package com.updownbot.hft.controller.decision;

/**
 * Consecutive same-side raw proposals for one symbol. {@code side} is null when the last cycle did not propose.
 */
public record PersistenceState(Side side, int consecutiveCount) {

    public static final PersistenceState NONE = new PersistenceState(null, 0);

    public boolean isPersisted(int requiredCount) {
        return side != null && consecutiveCount >= requiredCount;
    }
}
