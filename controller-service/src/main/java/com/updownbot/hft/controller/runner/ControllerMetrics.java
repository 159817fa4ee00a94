package com.updownbot.hft.controller.runner;

import com.updownbot.hft.controller.decision.DecisionType;
import com.updownbot.hft.controller.shadow.ShadowEvent;
import com.updownbot.hft.controller.shadow.ShadowProposal;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.EnumMap;
import java.util.Map;

public class ControllerMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter cycles;
    private final Counter cycleFailures;
    private final Timer cycleDuration;
    private final Counter shadowOpened;
    private final Map<DecisionType, Counter> decisions = new EnumMap<>(DecisionType.class);

    public ControllerMetrics(MeterRegistry meterRegistry, ControllerContext context) {
        this.meterRegistry = meterRegistry;
        this.cycles = Counter.builder("controller.cycles")
                .description("Completed decision cycles")
                .register(meterRegistry);
        this.cycleFailures = Counter.builder("controller.cycles.failed")
                .description("Decision cycles that threw")
                .register(meterRegistry);
        this.cycleDuration = Timer.builder("controller.cycle.duration")
                .description("Wall time of one decision cycle")
                .register(meterRegistry);
        this.shadowOpened = Counter.builder("controller.shadow.opened")
                .description("Shadow proposals opened")
                .register(meterRegistry);
        for (DecisionType type : DecisionType.values()) {
            decisions.put(type, Counter.builder("controller.decisions")
                    .tag("type", type.name())
                    .register(meterRegistry));
        }
        Gauge.builder("controller.shadow.pending", context, ControllerContext::pendingShadowProposals)
                .description("Shadow proposals awaiting resolution")
                .register(meterRegistry);
    }

    public Timer cycleDuration() {
        return cycleDuration;
    }

    public void cycleCompleted() {
        cycles.increment();
    }

    public void cycleFailed() {
        cycleFailures.increment();
    }

    public void decision(DecisionType type) {
        decisions.get(type).increment();
    }

    public void shadowOpened() {
        shadowOpened.increment();
    }

    public void shadowEvent(ShadowProposal event) {
        if (event.event() == ShadowEvent.CREATED) {
            return;
        }
        String outcome = event.outcome() == null ? "NONE" : event.outcome().name();
        Counter.builder("controller.shadow.events")
                .tag("event", event.event().name())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
