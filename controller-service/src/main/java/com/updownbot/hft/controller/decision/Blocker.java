package com.updownbot.hft.controller.decision;

import com.updownbot.hft.controller.gate.GateName;

/**
 * Why a cycle did not end in a proposal, in precedence order. Only the first applicable blocker is reported.
 */
public enum Blocker {
    NO_MARKET,
    /** Evaluating the symbol threw; the cycle carried on without it. */
    EVALUATION_ERROR,
    NO_BOOK,
    NO_CEX_FEED,
    NO_SIGNAL,
    NO_ASK,
    BELOW_THRESHOLD,
    COSTS_TOO_HIGH,
    PERSISTENCE,
    SANITY,
    SPREAD,
    DEPTH,
    TIME_REMAINING,
    CEX_FEED,
    /** Persisted and gated, but too close to the window close to enter. */
    EXIT_WINDOW;

    public boolean isGate() {
        return this == SANITY || this == SPREAD || this == DEPTH || this == TIME_REMAINING || this == CEX_FEED;
    }

    public static Blocker of(GateName gate) {
        return switch (gate) {
            case SANITY -> SANITY;
            case SPREAD -> SPREAD;
            case DEPTH -> DEPTH;
            case TIME_REMAINING -> TIME_REMAINING;
            case CEX_FEED -> CEX_FEED;
        };
    }
}
