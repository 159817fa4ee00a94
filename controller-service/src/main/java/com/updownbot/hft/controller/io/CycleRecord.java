package com.updownbot.hft.controller.io;

import com.updownbot.hft.controller.decision.Decision;

import java.time.Instant;
import java.util.List;

/**
 * One decision-log line: every symbol's decision for a single cycle.
 */
public record CycleRecord(
        long cycle,
        Instant timestamp,
        boolean feedConnected,
        boolean shadowMode,
        List<Decision> decisions
) {
    public CycleRecord {
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
    }
}
