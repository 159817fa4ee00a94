package com.updownbot.hft.controller.shadow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.updownbot.hft.controller.decision.Decision;
import com.updownbot.hft.controller.decision.DecisionType;
import com.updownbot.hft.controller.decision.Side;
import com.updownbot.hft.outcome.MarketOutcome;

import java.time.Instant;

/**
 * A paper position taken on an escalated proposal. Each state change produces a new instance and a
 * new line in the shadow log; the last line per id is the current state.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ShadowProposal(
        ShadowEvent event,
        String id,
        long cycle,
        Instant createdAt,
        String symbol,
        String slug,
        Side side,
        DecisionType decision,
        Double probability,
        Double z,
        Double upMid,
        Double dnMid,
        Double edge,
        Double netEdge,
        Double entryPrice,
        Double fees,
        Double slippage,
        double buffer,
        Double referencePrice,
        Double return60s,
        Double vol60s,
        boolean volFloorHit,
        boolean zClamped,
        boolean probabilityClamped,
        Instant windowEnd,
        ShadowStatus status,
        MarketOutcome outcome,
        Boolean won,
        Double realizedPnl,
        int resolutionAttempts,
        Instant resolvedAt
) {

    public static ShadowProposal open(String id, Decision d, Instant now) {
        return new ShadowProposal(ShadowEvent.CREATED, id, d.cycle(), now, d.symbol(), d.slug(), d.buySide(),
                d.decision(), d.probability(), d.z(), d.upMid(), d.dnMid(), d.edge(), d.netEdge(), d.buyPrice(),
                d.fees(), d.slippage(), d.buffer(), d.referencePrice(), d.return60s(), d.vol60s(), d.volFloorHit(),
                d.zClamped(), d.probabilityClamped(), d.windowEnd(), ShadowStatus.PENDING, null, null, null, 0, null);
    }

    public boolean isDue(Instant now) {
        return status == ShadowStatus.PENDING && windowEnd != null && windowEnd.isBefore(now);
    }

    public ShadowProposal deferred(MarketOutcome lastOutcome) {
        return new ShadowProposal(ShadowEvent.DEFERRED, id, cycle, createdAt, symbol, slug, side, decision, probability,
                z, upMid, dnMid, edge, netEdge, entryPrice, fees, slippage, buffer, referencePrice, return60s, vol60s,
                volFloorHit, zClamped, probabilityClamped, windowEnd, ShadowStatus.PENDING, lastOutcome, null, null,
                resolutionAttempts + 1, null);
    }

    /**
     * Closes the proposal. {@code won} and the realized PnL are null when the outcome never settled.
     */
    public ShadowProposal resolved(MarketOutcome finalOutcome, Instant now) {
        Boolean w = null;
        Double pnl = null;
        if (finalOutcome.isSettled()) {
            w = (side == Side.UP) == (finalOutcome == MarketOutcome.UP_WON);
            pnl = realizedPnl(w, entryPrice, fees, slippage, buffer);
        }
        return new ShadowProposal(ShadowEvent.RESOLVED, id, cycle, createdAt, symbol, slug, side, decision, probability,
                z, upMid, dnMid, edge, netEdge, entryPrice, fees, slippage, buffer, referencePrice, return60s, vol60s,
                volFloorHit, zClamped, probabilityClamped, windowEnd, ShadowStatus.RESOLVED, finalOutcome, w, pnl,
                resolutionAttempts + 1, now);
    }

    /**
     * Per-share PnL of buying at {@code entryPrice}: the binary pays 1 on a win, net of the modelled costs.
     */
    static double realizedPnl(boolean won, Double entryPrice, Double fees, Double slippage, double buffer) {
        double entry = entryPrice == null ? 0.0 : entryPrice;
        double gross = won ? 1.0 - entry : -entry;
        return gross - nz(fees) - nz(slippage) - buffer;
    }

    private static double nz(Double v) {
        return v == null ? 0.0 : v;
    }
}
