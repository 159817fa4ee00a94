package com.updownbot.hft.controller.cost;

import com.updownbot.hft.controller.config.CostConfig;

/**
 * Execution cost of buying one side at its ask: a taker fee that peaks at p = 0.5 and
 * vanishes at the edges, plus slippage that shrinks with the size resting at the touch.
 */
public class CostModel {

    static final double[][] REFERENCE_POINTS = {
            {0.5, 0.015625},
            {0.1, 0.002025},
    };
    static final double REFERENCE_TOLERANCE = 1e-10;

    private final CostConfig config;

    public CostModel(CostConfig config) {
        this.config = config;
    }

    public double fee(double price) {
        if (!(price > 0.0) || price >= 1.0) {
            return 0.0;
        }
        return config.feeRate() * Math.pow(price * (1.0 - price), config.feeExponent());
    }

    /**
     * @param askSize size at the best ask; null or non-positive means unknown and costs the maximum
     */
    public double slippage(Double askSize) {
        if (askSize == null || !(askSize > 0.0) || !Double.isFinite(askSize)) {
            return config.maxSlippage();
        }
        return Math.min(config.notionalUsdc() / (askSize * config.slippageCoefficient()), config.maxSlippage());
    }

    /**
     * Verifies the fee curve against the published reference points.
     *
     * @throws FeeCurveMismatchException if any point is off by more than the tolerance
     */
    public void verifyFeeCurve() {
        for (double[] point : REFERENCE_POINTS) {
            double actual = fee(point[0]);
            if (Math.abs(actual - point[1]) > REFERENCE_TOLERANCE) {
                throw new FeeCurveMismatchException(
                        "fee(%s)=%s, expected %s".formatted(point[0], actual, point[1]));
            }
        }
    }

    public CostConfig config() {
        return config;
    }
}
