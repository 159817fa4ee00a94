package com.updownbot.hft.controller.config;

import com.updownbot.hft.config.HftProperties;

/**
 * Probability model parameters.
 */
public record SignalConfig(
        double volFloor,
        double volMultiplier,
        double sigmoidK,
        double epsilon,
        double zClamp,
        double probabilityMin,
        double probabilityMax
) {
    public static SignalConfig defaults() {
        return new SignalConfig(0.0002, 1.0, 1.0, 1e-6, 6.0, 0.01, 0.99);
    }

    public static SignalConfig from(HftProperties.Signal s) {
        return new SignalConfig(s.volFloor(), s.volMultiplier(), s.sigmoidK(), s.epsilon(), s.zClamp(),
                s.probabilityMin(), s.probabilityMax());
    }

    public SignalConfig withVolFloor(double value) {
        return new SignalConfig(value, volMultiplier, sigmoidK, epsilon, zClamp, probabilityMin, probabilityMax);
    }
}
