package com.updownbot.hft.controller.runner;

import com.updownbot.hft.controller.decision.CounterfactualAnalyzer;
import com.updownbot.hft.controller.decision.Counterfactuals;
import com.updownbot.hft.controller.decision.Decision;
import com.updownbot.hft.controller.decision.DecisionEngine;
import com.updownbot.hft.controller.decision.DecisionInput;
import com.updownbot.hft.controller.decision.DecisionType;
import com.updownbot.hft.controller.decision.Evaluation;
import com.updownbot.hft.controller.decision.PersistenceState;
import com.updownbot.hft.controller.feed.FeatureSnapshot;
import com.updownbot.hft.controller.feed.FeedBuffer;
import com.updownbot.hft.controller.io.ControllerSnapshotWriter;
import com.updownbot.hft.controller.io.CycleRecord;
import com.updownbot.hft.controller.io.DecisionLog;
import com.updownbot.hft.controller.shadow.ShadowLedger;
import com.updownbot.hft.controller.shadow.ShadowProposal;
import com.updownbot.hft.controller.shadow.ShadowStats;
import com.updownbot.hft.market.MarketResolver;
import com.updownbot.hft.market.MarketWindowState;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * One decision cycle: resolve due shadow proposals, decide every tracked symbol, append one line to
 * the decision log, then overwrite the snapshot. Runs on the decision-loop thread only.
 * A failure for one symbol yields an explanatory {@code DO_NOTHING} row and never aborts the cycle.
 */
@Slf4j
@RequiredArgsConstructor
public class ControllerCycleRunner {

    private final @NonNull List<String> symbols;
    private final @NonNull MarketResolver marketResolver;
    private final @NonNull FeedBuffer feedBuffer;
    private final @NonNull BooleanSupplier feedConnected;
    private final @NonNull DecisionEngine engine;
    private final @NonNull CounterfactualAnalyzer counterfactuals;
    private final @NonNull ShadowLedger shadowLedger;
    private final boolean shadowEnabled;
    private final @NonNull DecisionLog decisionLog;
    private final @NonNull ControllerSnapshotWriter snapshotWriter;
    private final @NonNull ControllerContext context;
    private final @NonNull ControllerMetrics metrics;
    private final @NonNull Clock clock;
    private final long intervalMillis;

    public CycleResult runCycle() {
        long cycle = context.nextCycle();
        Instant now = clock.instant();

        List<ShadowProposal> shadowEvents = List.of();
        if (shadowEnabled) {
            try {
                shadowEvents = shadowLedger.resolveDue(now);
                shadowEvents.forEach(metrics::shadowEvent);
            } catch (RuntimeException e) {
                log.warn("cycle {}: shadow resolution failed: {}", cycle, e.getMessage());
            }
        }

        boolean connected = feedConnected.getAsBoolean();
        List<Decision> decisions = new ArrayList<>(symbols.size());
        for (String symbol : symbols) {
            Decision d;
            try {
                d = decide(cycle, symbol, now, connected);
            } catch (RuntimeException e) {
                log.warn("cycle {}: {} evaluation failed: {}", cycle, symbol, e.getMessage());
                context.persistence().reset(symbol);
                d = Decision.failed(cycle, now, symbol, "evaluation failed: " + e.getMessage(),
                        engine.config().requiredCount());
            }
            context.record(d);
            metrics.decision(d.decision());
            decisions.add(d);
        }
        decisionLog.append(new CycleRecord(cycle, now, connected, shadowEnabled, decisions));

        ShadowStats stats = shadowEnabled ? shadowLedger.stats() : ShadowStats.empty();
        snapshotWriter.write(context.snapshot(now, connected, shadowLedger.pendingCount(), stats, intervalMillis,
                engine.config()));

        logSummary(cycle, connected, decisions);
        return new CycleResult(cycle, now, decisions, shadowEvents);
    }

    private Decision decide(long cycle, String symbol, Instant now, boolean connected) {
        FeatureSnapshot features = feedBuffer.features(symbol, now.toEpochMilli());
        int required = engine.config().requiredCount();

        Optional<MarketWindowState> market;
        try {
            market = marketResolver.resolve(symbol, now);
        } catch (RuntimeException e) {
            log.warn("cycle {}: market lookup for {} failed: {}", cycle, symbol, e.getMessage());
            context.persistence().reset(symbol);
            return Decision.noMarket(cycle, now, symbol, "market lookup failed: " + e.getMessage(), features, required);
        }
        if (market.isEmpty()) {
            context.persistence().reset(symbol);
            return Decision.noMarket(cycle, now, symbol, "no active market", features, required);
        }

        DecisionInput input = new DecisionInput(symbol, market.get(), features, connected, now);
        PersistenceState previous = context.persistence().current(symbol);
        Evaluation evaluation = engine.evaluate(input, previous);
        Counterfactuals cf = counterfactuals.analyze(input, previous, evaluation);
        context.persistence().store(symbol, evaluation.nextPersistence());

        Decision decision = Decision.of(cycle, input, evaluation, cf);
        if (shadowEnabled && decision.decision().isPropose()) {
            decision = decision.withShadowId(shadowLedger.recordProposal(decision));
            metrics.shadowOpened();
        }
        if (decision.decision() != DecisionType.DO_NOTHING) {
            log.info(">>> {} {} | p={} z={} upMid={} | edge={} net={} | persist={}/{}{}",
                    symbol, decision.decision(), decision.probability(), decision.z(), decision.upMid(),
                    decision.edge(), decision.netEdge(), decision.persistenceCount(), decision.persistenceNeeded(),
                    decision.shadowId() == null ? "" : " shadow=" + decision.shadowId());
        }
        return decision;
    }

    private void logSummary(long cycle, boolean connected, List<Decision> decisions) {
        StringBuilder sb = new StringBuilder();
        for (Decision d : decisions) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(d.symbol()).append('=').append(d.decision());
            if (d.dominantBlocker() != null) {
                sb.append('(').append(d.dominantBlocker()).append(')');
            }
        }
        log.info("cycle {} feed={} {}", cycle, connected ? "up" : "down", sb);
    }
}
