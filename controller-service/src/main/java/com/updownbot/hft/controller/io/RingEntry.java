package com.updownbot.hft.controller.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.updownbot.hft.controller.decision.Decision;
import com.updownbot.hft.controller.decision.DecisionType;

import java.time.Instant;

/**
 * Compact per-cycle history row kept in the snapshot.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RingEntry(
        Instant timestamp,
        DecisionType decision,
        Double netEdge,
        Double probability,
        Double z,
        Double upMid,
        Double dnMid,
        Double referencePrice,
        double timeRemaining
) {
    public static RingEntry of(Decision d) {
        return new RingEntry(d.timestamp(), d.decision(), d.netEdge(), d.probability(), d.z(), d.upMid(), d.dnMid(),
                d.referencePrice(), d.timeRemaining());
    }
}
