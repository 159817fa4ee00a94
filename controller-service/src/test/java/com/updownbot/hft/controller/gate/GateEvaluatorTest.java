package com.updownbot.hft.controller.gate;

import com.updownbot.hft.controller.config.GateConfig;
import com.updownbot.hft.market.MarketWindowState;
import com.updownbot.hft.market.SideQuote;
import org.junit.jupiter.api.Test;

import static com.updownbot.hft.controller.ControllerFixtures.cheapUpMarket;
import static com.updownbot.hft.controller.ControllerFixtures.market;
import static com.updownbot.hft.controller.ControllerFixtures.quote;
import static com.updownbot.hft.controller.ControllerFixtures.secondsIntoWindow;
import static org.assertj.core.api.Assertions.assertThat;

class GateEvaluatorTest {

    private final GateEvaluator evaluator = new GateEvaluator(GateConfig.defaults());

    @Test
    void healthyBookPassesEveryGate() {
        GateReport report = evaluator.evaluate(cheapUpMarket(), true, secondsIntoWindow(60));

        assertThat(report.allPass()).isTrue();
        assertThat(report.firstFailing()).isEmpty();
        assertThat(report.results()).extracting(GateResult::name).containsExactly(GateName.values());
        assertThat(report.timeRemainingSeconds()).isEqualTo(840.0);
    }

    @Test
    void evaluatesAllGatesWithoutShortCircuit() {
        MarketWindowState bad = market(quote(0.30, 0.50, 5.0), quote(0.70, 0.90, 5.0));

        GateReport report = evaluator.evaluate(bad, false, secondsIntoWindow(800));

        assertThat(report.allPass()).isFalse();
        assertThat(report.results()).noneMatch(GateResult::pass);
        assertThat(report.firstFailing()).map(GateResult::name).contains(GateName.SANITY);
    }

    @Test
    void usesTighterSpreadAndDeeperAsk() {
        MarketWindowState mixed = market(quote(0.35, 0.45, 10.0), quote(0.59, 0.61, 80.0));

        GateReport report = evaluator.evaluate(mixed, true, secondsIntoWindow(0));

        assertThat(report.passed(GateName.SPREAD)).isTrue();
        assertThat(report.passed(GateName.DEPTH)).isTrue();
    }

    @Test
    void missingBookDataFailsSanitySpreadAndDepth() {
        MarketWindowState empty = market(SideQuote.empty(), SideQuote.empty());

        GateReport report = evaluator.evaluate(empty, true, secondsIntoWindow(0));

        assertThat(report.passed(GateName.SANITY)).isFalse();
        assertThat(report.passed(GateName.SPREAD)).isFalse();
        assertThat(report.passed(GateName.DEPTH)).isFalse();
        assertThat(report.passed(GateName.TIME_REMAINING)).isTrue();
        assertThat(report.passed(GateName.CEX_FEED)).isTrue();
    }

    @Test
    void timeRemainingBoundaryIsInclusive() {
        assertThat(evaluator.evaluate(cheapUpMarket(), true, secondsIntoWindow(660)).passed(GateName.TIME_REMAINING)).isTrue();
        assertThat(evaluator.evaluate(cheapUpMarket(), true, secondsIntoWindow(661)).passed(GateName.TIME_REMAINING)).isFalse();
    }
}
