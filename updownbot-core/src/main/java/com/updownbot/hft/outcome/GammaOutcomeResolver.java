package com.updownbot.hft.outcome;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.updownbot.hft.polymarket.discovery.PolymarketMarketParser;
import com.updownbot.hft.polymarket.gamma.PolymarketGammaClient;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Reads {@code outcomePrices[0]} (the "Up" price) from Gamma {@code /markets?slug=}.
 * Above {@link #UP_THRESHOLD} Up won, below {@link #DOWN_THRESHOLD} Down won.
 */
@Slf4j
@RequiredArgsConstructor
public class GammaOutcomeResolver implements OutcomeResolver {

  static final double UP_THRESHOLD = 0.9;
  static final double DOWN_THRESHOLD = 0.1;

  private final @NonNull PolymarketGammaClient gammaClient;
  private final @NonNull ObjectMapper objectMapper;

  @Override
  public MarketOutcome resolve(String slug) {
    JsonNode root;
    try {
      root = gammaClient.marketsBySlug(slug);
    } catch (RuntimeException e) {
      log.warn("outcome lookup failed for {}: {}", slug, e.getMessage());
      return MarketOutcome.FETCH_ERROR;
    }
    List<JsonNode> markets = PolymarketMarketParser.extractMarkets(root);
    if (markets.isEmpty()) {
      return MarketOutcome.UNRESOLVED;
    }
    Optional<Double> upPrice = PolymarketMarketParser.firstOutcomePrice(markets.get(0), objectMapper);
    if (upPrice.isEmpty()) {
      return MarketOutcome.UNRESOLVED;
    }
    double p = upPrice.get();
    if (p > UP_THRESHOLD) {
      return MarketOutcome.UP_WON;
    }
    if (p < DOWN_THRESHOLD) {
      return MarketOutcome.DOWN_WON;
    }
    return MarketOutcome.UNRESOLVED;
  }
}
