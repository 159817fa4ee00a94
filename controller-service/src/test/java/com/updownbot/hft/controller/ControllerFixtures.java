package com.updownbot.hft.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.updownbot.hft.controller.config.DecisionConfig;
import com.updownbot.hft.controller.decision.Counterfactuals;
import com.updownbot.hft.controller.decision.Decision;
import com.updownbot.hft.controller.decision.DecisionEngine;
import com.updownbot.hft.controller.decision.DecisionInput;
import com.updownbot.hft.controller.decision.PersistenceState;
import com.updownbot.hft.controller.decision.Side;
import com.updownbot.hft.controller.feed.FeatureSnapshot;
import com.updownbot.hft.market.MarketWindowState;
import com.updownbot.hft.market.SideQuote;

import java.time.Instant;

/**
 * Shared market and feature fixtures around the 2026-02-24T09:30:00Z window.
 */
public final class ControllerFixtures {

    public static final long SLOT = 1_771_925_400L;
    public static final Instant WINDOW_START = Instant.ofEpochSecond(SLOT);
    public static final Instant WINDOW_END = WINDOW_START.plusSeconds(900);

    private ControllerFixtures() {
    }

    public static Instant secondsIntoWindow(long seconds) {
        return WINDOW_START.plusSeconds(seconds);
    }

    public static SideQuote quote(double bid, double ask, Double askSize) {
        return new SideQuote(bid, ask, (bid + ask) / 2.0, askSize);
    }

    /**
     * Up 0.39/0.41, Down 0.61/0.63, deep asks.
     */
    public static MarketWindowState cheapUpMarket() {
        return market(quote(0.39, 0.41, 10_000.0), quote(0.61, 0.63, 10_000.0));
    }

    public static MarketWindowState market(SideQuote up, SideQuote down) {
        return MarketWindowState.of("BTC", MarketWindowState.slugFor("BTC", WINDOW_START), up, down, WINDOW_START, WINDOW_END);
    }

    public static FeatureSnapshot features(double ret, double vol) {
        return new FeatureSnapshot("BTC", 97_000.0, ret, vol, true, 60, 240, null);
    }

    /**
     * Strong upward move: p is about 0.98.
     */
    public static FeatureSnapshot strongUp() {
        return features(0.002, 0.0005);
    }

    public static DecisionInput input(MarketWindowState market, FeatureSnapshot features, long secondsIntoWindow) {
        return new DecisionInput("BTC", market, features, true, secondsIntoWindow(secondsIntoWindow));
    }

    /**
     * A persisted PROPOSE_UP on {@link #cheapUpMarket()} one minute into the window.
     */
    public static Decision proposeUp(long cycle) {
        DecisionInput in = input(cheapUpMarket(), strongUp(), 60);
        DecisionEngine engine = new DecisionEngine(DecisionConfig.defaults());
        return Decision.of(cycle, in, engine.evaluate(in, new PersistenceState(Side.UP, 1)), Counterfactuals.NONE);
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper().findAndRegisterModules().disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
