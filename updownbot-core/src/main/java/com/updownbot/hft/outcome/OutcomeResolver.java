package com.updownbot.hft.outcome;

/**
 * Looks up the settled outcome of an Up/Down market by slug. Implementations never throw;
 * lookup failures map to {@link MarketOutcome#FETCH_ERROR}.
 */
public interface OutcomeResolver {

  MarketOutcome resolve(String slug);
}
