package com.updownbot.hft.controller.decision;

/**
 * "Would this cycle have proposed if exactly one constraint were relaxed?"
 *
 * @param blockingCount how many of the four relaxable constraints failed in the actual evaluation
 */
public record Counterfactuals(
        boolean proposeWithRelaxedNetEdge,
        boolean proposeWithPersistenceOne,
        boolean proposeWithoutVolFloor,
        boolean proposeWithRelaxedSpread,
        int blockingCount
) {
    public static final Counterfactuals NONE = new Counterfactuals(false, false, false, false, 0);
}
