package com.updownbot.hft.controller.decision;

public enum DecisionType {
    DO_NOTHING,
    CANDIDATE_UP,
    CANDIDATE_DN,
    PROPOSE_UP,
    PROPOSE_DN,
    EXIT;

    public static DecisionType propose(Side side) {
        return side == Side.UP ? PROPOSE_UP : PROPOSE_DN;
    }

    public static DecisionType candidate(Side side) {
        return side == Side.UP ? CANDIDATE_UP : CANDIDATE_DN;
    }

    public boolean isPropose() {
        return this == PROPOSE_UP || this == PROPOSE_DN;
    }

    public boolean isCandidate() {
        return this == CANDIDATE_UP || this == CANDIDATE_DN;
    }
}
