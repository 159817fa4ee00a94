package com.updownbot.hft.controller.decision;

import com.updownbot.hft.controller.feed.FeatureSnapshot;
import com.updownbot.hft.market.MarketWindowState;

import java.time.Instant;

/**
 * One symbol's inputs for one cycle.
 */
public record DecisionInput(
        String symbol,
        MarketWindowState market,
        FeatureSnapshot features,
        boolean feedConnected,
        Instant now
) {
    public boolean feedHealthy() {
        return feedConnected && features != null && features.ok();
    }
}
