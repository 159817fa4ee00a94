package com.updownbot.hft.controller.cost;

import jakarta.annotation.PostConstruct;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Refuses to start when the fee curve is misconfigured; see {@link FeeCurveMismatchException}.
 */
@Slf4j
@RequiredArgsConstructor
public class FeeCurveSelfCheck {

    private final @NonNull CostModel costModel;

    @PostConstruct
    void verify() {
        try {
            costModel.verifyFeeCurve();
        } catch (FeeCurveMismatchException e) {
            log.error("fee curve self-check FAILED: {}", e.getMessage());
            throw e;
        }
        log.info("fee curve self-check passed (rate={}, exponent={})",
                costModel.config().feeRate(), costModel.config().feeExponent());
    }
}
