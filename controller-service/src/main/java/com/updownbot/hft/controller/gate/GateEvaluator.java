package com.updownbot.hft.controller.gate;

import com.updownbot.hft.controller.config.GateConfig;
import com.updownbot.hft.market.MarketWindowState;
import com.updownbot.hft.market.SideQuote;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates every hard gate independently; a failing gate never short-circuits the others.
 */
public class GateEvaluator {

    private static final double MISSING_SPREAD = 1.0;

    private final GateConfig config;

    public GateEvaluator(GateConfig config) {
        this.config = config;
    }

    public GateReport evaluate(MarketWindowState market, boolean cexFeedHealthy, Instant now) {
        List<GateResult> results = new ArrayList<>(GateName.values().length);

        Double sanitySum = market.sanitySum();
        boolean sanityOk = sanitySum != null && Math.abs(sanitySum - 1.0) <= config.sanityTolerance();
        results.add(new GateResult(GateName.SANITY, sanityOk, sanitySum, config.sanityTolerance()));

        double spread = Math.min(spreadOrMissing(market.up()), spreadOrMissing(market.down()));
        results.add(new GateResult(GateName.SPREAD, spread <= config.maxSpread(), spread, config.maxSpread()));

        double depth = Math.max(askSizeOrZero(market.up()), askSizeOrZero(market.down()));
        results.add(new GateResult(GateName.DEPTH, depth >= config.minDepth(), depth, config.minDepth()));

        double remaining = market.secondsRemaining(now);
        results.add(new GateResult(GateName.TIME_REMAINING, remaining >= config.minSecondsRemaining(),
                remaining, (double) config.minSecondsRemaining()));

        results.add(new GateResult(GateName.CEX_FEED, cexFeedHealthy, cexFeedHealthy ? 1.0 : 0.0, 1.0));

        boolean allPass = results.stream().allMatch(GateResult::pass);
        return new GateReport(results, allPass, remaining);
    }

    private static double spreadOrMissing(SideQuote quote) {
        Double spread = quote.spread();
        return spread == null ? MISSING_SPREAD : spread;
    }

    private static double askSizeOrZero(SideQuote quote) {
        return quote.askSize() == null ? 0.0 : quote.askSize();
    }
}
