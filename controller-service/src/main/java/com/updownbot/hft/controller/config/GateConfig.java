package com.updownbot.hft.controller.config;

import com.updownbot.hft.config.HftProperties;

/**
 * Hard safety gate thresholds.
 */
public record GateConfig(
        double sanityTolerance,
        double maxSpread,
        double minDepth,
        long minSecondsRemaining
) {
    public static GateConfig defaults() {
        return new GateConfig(0.05, 0.03, 50.0, 240);
    }

    public static GateConfig from(HftProperties.Gates g) {
        return new GateConfig(g.sanityTolerance(), g.maxSpread(), g.minDepth(), g.minSecondsRemaining());
    }

    public GateConfig withMaxSpread(double value) {
        return new GateConfig(sanityTolerance, value, minDepth, minSecondsRemaining);
    }
}
