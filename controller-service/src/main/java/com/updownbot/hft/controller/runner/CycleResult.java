package com.updownbot.hft.controller.runner;

import com.updownbot.hft.controller.decision.Decision;
import com.updownbot.hft.controller.shadow.ShadowProposal;

import java.time.Instant;
import java.util.List;

public record CycleResult(long cycle, Instant startedAt, List<Decision> decisions, List<ShadowProposal> shadowEvents) {
}
