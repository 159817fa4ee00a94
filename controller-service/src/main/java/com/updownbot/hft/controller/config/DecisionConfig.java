package com.updownbot.hft.controller.config;

import com.updownbot.hft.config.HftProperties;

/**
 * Everything one decision evaluation depends on. Counterfactuals are evaluated against copies with a
 * single field relaxed.
 */
public record DecisionConfig(
        SignalConfig signal,
        CostConfig cost,
        GateConfig gates,
        double proposalThreshold,
        double buffer,
        double minNetEdge,
        long exitSecondsRemaining,
        int requiredCount
) {
    public static DecisionConfig defaults() {
        return new DecisionConfig(SignalConfig.defaults(), CostConfig.defaults(), GateConfig.defaults(),
                0.02, 0.005, 0.03, 120, 2);
    }

    public static DecisionConfig from(HftProperties.Controller c) {
        return new DecisionConfig(
                SignalConfig.from(c.signal()),
                CostConfig.from(c.cost()),
                GateConfig.from(c.gates()),
                c.edge().proposalThreshold(),
                c.edge().buffer(),
                c.edge().minNetEdge(),
                c.edge().exitSecondsRemaining(),
                c.persistence().requiredCount()
        );
    }

    public DecisionConfig withSignal(SignalConfig value) {
        return new DecisionConfig(value, cost, gates, proposalThreshold, buffer, minNetEdge, exitSecondsRemaining, requiredCount);
    }

    public DecisionConfig withGates(GateConfig value) {
        return new DecisionConfig(signal, cost, value, proposalThreshold, buffer, minNetEdge, exitSecondsRemaining, requiredCount);
    }

    public DecisionConfig withMinNetEdge(double value) {
        return new DecisionConfig(signal, cost, gates, proposalThreshold, buffer, value, exitSecondsRemaining, requiredCount);
    }

    public DecisionConfig withRequiredCount(int value) {
        return new DecisionConfig(signal, cost, gates, proposalThreshold, buffer, minNetEdge, exitSecondsRemaining, value);
    }
}
