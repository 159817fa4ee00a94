package com.updownbot.hft.controller.config;

import com.updownbot.hft.config.HftProperties;

/**
 * Taker fee curve and slippage parameters.
 */
public record CostConfig(
        double feeRate,
        double feeExponent,
        double notionalUsdc,
        double slippageCoefficient,
        double maxSlippage
) {
    public static CostConfig defaults() {
        return new CostConfig(0.25, 2.0, 100.0, 2.0, 0.05);
    }

    public static CostConfig from(HftProperties.Cost c) {
        return new CostConfig(c.feeRate(), c.feeExponent(), c.notionalUsdc(), c.slippageCoefficient(), c.maxSlippage());
    }
}
