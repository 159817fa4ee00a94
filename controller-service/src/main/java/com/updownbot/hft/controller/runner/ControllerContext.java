package com.updownbot.hft.controller.runner;

import com.updownbot.hft.controller.config.DecisionConfig;
import com.updownbot.hft.controller.decision.Decision;
import com.updownbot.hft.controller.decision.DecisionType;
import com.updownbot.hft.controller.decision.PersistenceTracker;
import com.updownbot.hft.controller.io.DecisionRingBuffer;
import com.updownbot.hft.controller.io.RingEntry;
import com.updownbot.hft.controller.shadow.ShadowStats;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable per-run state of the decision loop. Everything except {@link #latestSnapshot()} and
 * {@link #pendingShadowProposals()} is confined to the loop thread; those two are published for readers
 * on other threads.
 */
public class ControllerContext {

    private final PersistenceTracker persistence = new PersistenceTracker();
    private final DecisionRingBuffer ring;
    private final Map<String, Decision> latestDecisions = new LinkedHashMap<>();
    private final Map<DecisionType, Long> decisionCounts = new EnumMap<>(DecisionType.class);
    private long cycle;

    private volatile ControllerSnapshot latestSnapshot;
    private volatile int pendingShadowProposals;

    public ControllerContext(int ringBufferSize) {
        this.ring = new DecisionRingBuffer(ringBufferSize);
    }

    public PersistenceTracker persistence() {
        return persistence;
    }

    public DecisionRingBuffer ring() {
        return ring;
    }

    public long cycle() {
        return cycle;
    }

    /**
     * Continues numbering after the given cycle, e.g. the last one found in the decision log.
     */
    public void resumeAfter(long lastCycle) {
        cycle = Math.max(cycle, lastCycle);
    }

    public long nextCycle() {
        return ++cycle;
    }

    public void record(Decision decision) {
        latestDecisions.put(decision.symbol(), decision);
        decisionCounts.merge(decision.decision(), 1L, Long::sum);
        ring.add(decision.symbol(), RingEntry.of(decision));
    }

    public ControllerSnapshot snapshot(Instant now, boolean feedConnected, int pendingShadow, ShadowStats stats,
                                       long intervalMillis, DecisionConfig config) {
        pendingShadowProposals = pendingShadow;
        ControllerSnapshot snapshot = new ControllerSnapshot(
                now,
                cycle,
                feedConnected,
                Map.copyOf(latestDecisions),
                Map.copyOf(decisionCounts),
                pendingShadow,
                stats,
                ring.snapshot(),
                intervalMillis,
                config
        );
        latestSnapshot = snapshot;
        return snapshot;
    }

    public ControllerSnapshot latestSnapshot() {
        return latestSnapshot;
    }

    public int pendingShadowProposals() {
        return pendingShadowProposals;
    }
}
