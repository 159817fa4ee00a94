package com.updownbot.hft.controller.decision;

import com.updownbot.hft.controller.config.DecisionConfig;
import com.updownbot.hft.controller.gate.GateName;

/**
 * Re-runs the {@link DecisionEngine} with one constraint relaxed at a time. Purely diagnostic: the
 * persistence state produced by the relaxed runs is discarded.
 */
public class CounterfactualAnalyzer {

    private final DecisionEngine relaxedNetEdge;
    private final DecisionEngine persistenceOne;
    private final DecisionEngine noVolFloor;
    private final DecisionEngine relaxedSpread;
    private final DecisionConfig base;

    public CounterfactualAnalyzer(DecisionEngine engine, double relaxedMinNetEdge, double relaxedMaxSpread) {
        this.base = engine.config();
        this.relaxedNetEdge = engine.withConfig(base.withMinNetEdge(relaxedMinNetEdge));
        this.persistenceOne = engine.withConfig(base.withRequiredCount(1));
        this.noVolFloor = engine.withConfig(base.withSignal(base.signal().withVolFloor(0.0)));
        this.relaxedSpread = engine.withConfig(base.withGates(base.gates().withMaxSpread(relaxedMaxSpread)));
    }

    public Counterfactuals analyze(DecisionInput input, PersistenceState previous, Evaluation actual) {
        return new Counterfactuals(
                proposes(relaxedNetEdge, input, previous),
                proposes(persistenceOne, input, previous),
                proposes(noVolFloor, input, previous),
                proposes(relaxedSpread, input, previous),
                blockingCount(actual)
        );
    }

    private static boolean proposes(DecisionEngine engine, DecisionInput input, PersistenceState previous) {
        return engine.evaluate(input, previous).decision().isPropose();
    }

    private int blockingCount(Evaluation actual) {
        int count = 0;
        if (actual.netEdge() != null && actual.netEdge() < base.minNetEdge()) {
            count++;
        }
        if (actual.rawDecision().isPropose() && !actual.persisted()) {
            count++;
        }
        if (actual.estimate() != null && actual.estimate().volFloorHit()) {
            count++;
        }
        if (!actual.gates().passed(GateName.SPREAD)) {
            count++;
        }
        return count;
    }
}
