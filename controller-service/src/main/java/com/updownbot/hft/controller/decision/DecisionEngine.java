package com.updownbot.hft.controller.decision;

import com.updownbot.hft.controller.config.DecisionConfig;
import com.updownbot.hft.controller.cost.CostModel;
import com.updownbot.hft.controller.feed.FeatureSnapshot;
import com.updownbot.hft.controller.gate.GateEvaluator;
import com.updownbot.hft.controller.gate.GateName;
import com.updownbot.hft.controller.gate.GateReport;
import com.updownbot.hft.controller.gate.GateResult;
import com.updownbot.hft.controller.signal.SignalEstimate;
import com.updownbot.hft.controller.signal.SignalModel;
import com.updownbot.hft.market.MarketWindowState;
import com.updownbot.hft.market.SideQuote;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns one symbol's cycle inputs into a decision. Checks run in a fixed precedence order and the
 * first failing one becomes the dominant blocker:
 * book, feed health, vol floor, ask, edge threshold, net edge, persistence, hard gates, exit window.
 * <p>
 * Stateless: the previous persistence state is passed in and the next one is returned, so the same
 * engine can be re-run with relaxed parameters without side effects.
 */
public class DecisionEngine {

    private final DecisionConfig config;
    private final SignalModel signalModel;
    private final CostModel costModel;
    private final GateEvaluator gateEvaluator;

    public DecisionEngine(DecisionConfig config) {
        this.config = config;
        this.signalModel = new SignalModel(config.signal());
        this.costModel = new CostModel(config.cost());
        this.gateEvaluator = new GateEvaluator(config.gates());
    }

    public DecisionConfig config() {
        return config;
    }

    public DecisionEngine withConfig(DecisionConfig relaxed) {
        return new DecisionEngine(relaxed);
    }

    public Evaluation evaluate(DecisionInput input, PersistenceState previous) {
        MarketWindowState market = input.market();
        FeatureSnapshot features = input.features();
        boolean feedHealthy = input.feedHealthy();
        GateReport gates = gateEvaluator.evaluate(market, feedHealthy, input.now());

        Double upMid = market.up().mid();
        Double dnMid = market.down().mid();

        SignalEstimate estimate = null;
        Side buySide = null;
        Double buyPrice = null;
        Double edge = null;
        Double fees = null;
        Double slippage = null;
        Double netEdge = null;
        Blocker blocker = null;
        String reason;

        if (upMid == null || dnMid == null) {
            blocker = Blocker.NO_BOOK;
            reason = "no book data";
        } else if (!feedHealthy) {
            blocker = Blocker.NO_CEX_FEED;
            reason = feedReason(input);
        } else {
            estimate = signalModel.estimate(features.return60s(), features.vol60s());
            if (estimate.volFloorHit()) {
                blocker = Blocker.NO_SIGNAL;
                reason = "vol_60s=%s < floor=%s".formatted(fmt(features.vol60s(), 8), fmt(config.signal().volFloor(), 6));
            } else {
                buySide = estimate.probability() > upMid ? Side.UP : Side.DOWN;
                SideQuote quote = buySide == Side.UP ? market.up() : market.down();
                buyPrice = quote.ask();
                if (buyPrice == null) {
                    blocker = Blocker.NO_ASK;
                    reason = "no ask price on " + buySide;
                } else {
                    edge = Math.abs(estimate.probability() - upMid);
                    fees = costModel.fee(buyPrice);
                    slippage = costModel.slippage(quote.askSize());
                    netEdge = edge - fees - slippage - config.buffer();
                    if (edge < config.proposalThreshold()) {
                        blocker = Blocker.BELOW_THRESHOLD;
                        reason = "below threshold: edge=%s%% < %s%%".formatted(pct(edge, 3), pct(config.proposalThreshold(), 1));
                    } else if (netEdge < config.minNetEdge()) {
                        blocker = Blocker.COSTS_TOO_HIGH;
                        reason = "costs too high: netEdge=%s%% < %s%%".formatted(pct(netEdge, 2), pct(config.minNetEdge(), 1));
                    } else {
                        reason = "p=%s vs upMid=%s, edge=%s%%, netEdge=%s%%".formatted(
                                fmt(estimate.probability(), 4), fmt(upMid, 4), pct(edge, 2), pct(netEdge, 2));
                    }
                }
            }
            reason = annotateClamps(reason, estimate);
        }

        Side rawSide = blocker == null ? buySide : null;
        DecisionType raw = rawSide == null ? DecisionType.DO_NOTHING : DecisionType.propose(rawSide);
        PersistenceState next = PersistenceTracker.advance(previous, rawSide);
        boolean persisted = next.isPersisted(config.requiredCount());

        DecisionType decision = raw;
        List<GateName> failedGates = new ArrayList<>();
        for (GateResult r : gates.results()) {
            if (!r.pass()) {
                failedGates.add(r.name());
            }
        }

        if (rawSide != null) {
            if (!persisted) {
                decision = DecisionType.candidate(rawSide);
                blocker = Blocker.PERSISTENCE;
            } else if (!gates.allPass()) {
                decision = DecisionType.DO_NOTHING;
                blocker = Blocker.of(failedGates.get(0));
            } else if (gates.timeRemainingSeconds() < config.exitSecondsRemaining()) {
                decision = DecisionType.EXIT;
                blocker = Blocker.EXIT_WINDOW;
            }
        }

        return new Evaluation(decision, raw, blocker, reason, failedGates, estimate, buySide, buyPrice,
                edge, fees, slippage, config.buffer(), netEdge, gates, next, persisted, config.requiredCount());
    }

    private static String feedReason(DecisionInput input) {
        if (!input.feedConnected()) {
            return "NO_CEX_FEED: feed disconnected";
        }
        FeatureSnapshot f = input.features();
        if (f == null) {
            return "NO_CEX_FEED: no features";
        }
        return "NO_CEX_FEED: " + (f.reason() == null ? "features not ok" : f.reason());
    }

    private static String annotateClamps(String reason, SignalEstimate estimate) {
        if (estimate == null) {
            return reason;
        }
        List<String> flags = new ArrayList<>(2);
        if (estimate.zClamped()) {
            flags.add("z-clamped(%s->%s)".formatted(fmt(estimate.rawZ(), 2), fmt(estimate.z(), 2)));
        }
        if (estimate.probabilityClamped()) {
            flags.add("p-clamped");
        }
        return flags.isEmpty() ? reason : reason + " [" + String.join(", ", flags) + "]";
    }

    private static String fmt(double v, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f", v);
    }

    private static String pct(double v, int decimals) {
        return fmt(v * 100.0, decimals);
    }
}
