package com.updownbot.hft.controller.signal;

import com.updownbot.hft.controller.config.SignalConfig;

/**
 * Maps the reference return and volatility over the feature window to a probability of "Up":
 * {@code p = clamp(sigmoid(clamp(k * ret / (max(vol, floor * multiplier) + eps))))}.
 */
public class SignalModel {

    private final SignalConfig config;

    public SignalModel(SignalConfig config) {
        this.config = config;
    }

    /**
     * Non-finite or missing inputs are treated as a zero return and zero volatility, which always hits a
     * positive floor.
     */
    public SignalEstimate estimate(Double return60s, Double vol60s) {
        double ret = finiteOrZero(return60s);
        double vol = finiteOrZero(vol60s);

        boolean volFloorHit = vol < config.volFloor();
        double effectiveVol = Math.max(vol, config.volFloor() * config.volMultiplier());
        double rawZ = config.sigmoidK() * ret / (effectiveVol + config.epsilon());
        double z = Math.max(-config.zClamp(), Math.min(config.zClamp(), rawZ));
        double rawP = sigmoid(z);
        double p = Math.max(config.probabilityMin(), Math.min(config.probabilityMax(), rawP));

        return new SignalEstimate(p, z, rawZ, effectiveVol, volFloorHit, z != rawZ, p != rawP);
    }

    static double sigmoid(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }

    private static double finiteOrZero(Double v) {
        return v == null || !Double.isFinite(v) ? 0.0 : v;
    }
}
