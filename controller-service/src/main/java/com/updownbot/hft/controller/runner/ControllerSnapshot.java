package com.updownbot.hft.controller.runner;

import com.updownbot.hft.controller.config.DecisionConfig;
import com.updownbot.hft.controller.decision.Decision;
import com.updownbot.hft.controller.decision.DecisionType;
import com.updownbot.hft.controller.io.RingEntry;
import com.updownbot.hft.controller.shadow.ShadowStats;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * State written to the snapshot file after every cycle and served by the status endpoint.
 */
public record ControllerSnapshot(
        Instant updatedAt,
        long cycle,
        boolean feedConnected,
        Map<String, Decision> latestDecisions,
        Map<DecisionType, Long> decisionCounts,
        int pendingShadowProposals,
        ShadowStats shadowStats,
        Map<String, List<RingEntry>> history,
        long intervalMillis,
        DecisionConfig config
) {
}
