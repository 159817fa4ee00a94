package com.updownbot.hft.controller.decision;

import com.updownbot.hft.controller.gate.GateName;
import com.updownbot.hft.controller.gate.GateReport;
import com.updownbot.hft.controller.signal.SignalEstimate;

import java.util.List;

/**
 * Result of {@link DecisionEngine#evaluate}. Numeric fields are null when the evaluation stopped
 * before computing them.
 *
 * @param nextPersistence state to store for the next cycle
 */
public record Evaluation(
        DecisionType decision,
        DecisionType rawDecision,
        Blocker dominantBlocker,
        String reason,
        List<GateName> failedGates,
        SignalEstimate estimate,
        Side buySide,
        Double buyPrice,
        Double edge,
        Double fees,
        Double slippage,
        double buffer,
        Double netEdge,
        GateReport gates,
        PersistenceState nextPersistence,
        boolean persisted,
        int requiredCount
) {
    public Evaluation {
        failedGates = failedGates == null ? List.of() : List.copyOf(failedGates);
    }
}
