package com.updownbot.hft.controller.decision;

import com.updownbot.hft.controller.feed.FeatureSnapshot;
import com.updownbot.hft.controller.gate.GateResult;
import com.updownbot.hft.controller.signal.SignalEstimate;
import com.updownbot.hft.market.MarketWindowState;

import java.time.Instant;
import java.util.List;

/**
 * One symbol's decision for one cycle with the full trail that produced it. This is the record
 * written to the decision log.
 */
public record Decision(
        long cycle,
        Instant timestamp,
        String symbol,
        String slug,
        DecisionType decision,
        DecisionType signal,
        String reason,
        Blocker dominantBlocker,
        String gateBlock,
        Double probability,
        Double z,
        Double rawZ,
        boolean volFloorHit,
        boolean zClamped,
        boolean probabilityClamped,
        Double edge,
        Double fees,
        Double slippage,
        double buffer,
        Double netEdge,
        Side buySide,
        Double buyPrice,
        Double referencePrice,
        Double return60s,
        Double vol60s,
        Double upMid,
        Double dnMid,
        double timeRemaining,
        List<GateResult> gates,
        boolean allGatesPass,
        int persistenceCount,
        int persistenceNeeded,
        boolean persisted,
        Counterfactuals counterfactuals,
        Instant windowStart,
        Instant windowEnd,
        MarketWindowState book,
        String shadowId
) {

    public static Decision of(long cycle, DecisionInput input, Evaluation e, Counterfactuals counterfactuals) {
        MarketWindowState market = input.market();
        FeatureSnapshot f = input.features();
        SignalEstimate s = e.estimate();
        String gateBlock = e.dominantBlocker() != null && e.dominantBlocker().isGate()
                ? String.join(", ", e.failedGates().stream().map(Enum::name).toList())
                : null;
        return new Decision(
                cycle,
                input.now(),
                input.symbol(),
                market.slug(),
                e.decision(),
                e.rawDecision(),
                e.reason(),
                e.dominantBlocker(),
                gateBlock,
                s == null ? null : s.probability(),
                s == null ? null : s.z(),
                s == null ? null : s.rawZ(),
                s != null && s.volFloorHit(),
                s != null && s.zClamped(),
                s != null && s.probabilityClamped(),
                e.edge(),
                e.fees(),
                e.slippage(),
                e.buffer(),
                e.netEdge(),
                e.buySide(),
                e.buyPrice(),
                f == null ? null : f.referencePrice(),
                f == null ? null : f.return60s(),
                f == null ? null : f.vol60s(),
                market.up().mid(),
                market.down().mid(),
                e.gates().timeRemainingSeconds(),
                e.gates().results(),
                e.gates().allPass(),
                e.nextPersistence().consecutiveCount(),
                e.requiredCount(),
                e.persisted(),
                counterfactuals,
                market.windowStart(),
                market.windowEnd(),
                market,
                null
        );
    }

    /**
     * Placeholder row for a symbol whose market could not be resolved this cycle.
     */
    public static Decision noMarket(long cycle, Instant now, String symbol, String reason, FeatureSnapshot f, int persistenceNeeded) {
        return placeholder(cycle, now, symbol, reason, Blocker.NO_MARKET, f, persistenceNeeded);
    }

    /**
     * Placeholder row for a symbol whose evaluation threw.
     */
    public static Decision failed(long cycle, Instant now, String symbol, String reason, int persistenceNeeded) {
        return placeholder(cycle, now, symbol, reason, Blocker.EVALUATION_ERROR, null, persistenceNeeded);
    }

    private static Decision placeholder(long cycle, Instant now, String symbol, String reason, Blocker blocker,
                                        FeatureSnapshot f, int persistenceNeeded) {
        return new Decision(cycle, now, symbol, null, DecisionType.DO_NOTHING, DecisionType.DO_NOTHING, reason,
                blocker, null, null, null, null, false, false, false, null, null, null, 0.0, null, null, null,
                f == null ? null : f.referencePrice(), f == null ? null : f.return60s(), f == null ? null : f.vol60s(),
                null, null, 0.0, List.of(), false, 0, persistenceNeeded, false, Counterfactuals.NONE, null, null, null, null);
    }

    public Decision withShadowId(String id) {
        return new Decision(cycle, timestamp, symbol, slug, decision, signal, reason, dominantBlocker, gateBlock,
                probability, z, rawZ, volFloorHit, zClamped, probabilityClamped, edge, fees, slippage, buffer, netEdge,
                buySide, buyPrice, referencePrice, return60s, vol60s, upMid, dnMid, timeRemaining, gates, allGatesPass,
                persistenceCount, persistenceNeeded, persisted, counterfactuals, windowStart, windowEnd, book, id);
    }
}
