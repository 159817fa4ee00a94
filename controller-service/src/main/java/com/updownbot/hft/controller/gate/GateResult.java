package com.updownbot.hft.controller.gate;

/**
 * @param observedValue value the gate compared; null when it could not be measured
 * @param threshold     bound the value was compared against
 */
public record GateResult(GateName name, boolean pass, Double observedValue, Double threshold) {
}
