package com.updownbot.hft.polymarket.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Helpers for Gamma market payloads. Gamma returns {@code outcomes}, {@code clobTokenIds} and
 * {@code outcomePrices} either as JSON arrays or as JSON-encoded strings; both are accepted.
 */
public final class PolymarketMarketParser {

  private PolymarketMarketParser() {
  }

  /**
   * Flattens an {@code /events} or {@code /markets} response into market nodes. Event nodes
   * contribute their nested {@code markets}; bare market nodes are returned as-is.
   */
  public static List<JsonNode> extractMarkets(JsonNode root) {
    if (root == null || root.isNull() || root.isMissingNode()) {
      return List.of();
    }
    List<JsonNode> out = new ArrayList<>();
    if (root.isArray()) {
      for (JsonNode n : root) {
        collect(n, out);
      }
      return out;
    }
    JsonNode events = root.get("events");
    if (events != null && events.isArray()) {
      for (JsonNode n : events) {
        collect(n, out);
      }
      return out;
    }
    collect(root, out);
    return out;
  }

  public static String question(JsonNode market) {
    if (market == null) {
      return null;
    }
    String q = market.path("question").asText(null);
    return q == null || q.isBlank() ? null : q.trim();
  }

  public static String slug(JsonNode node) {
    if (node == null) {
      return null;
    }
    String s = node.path("slug").asText(null);
    return s == null || s.isBlank() ? null : s.trim();
  }

  public static Optional<Instant> endTime(JsonNode node) {
    if (node == null) {
      return Optional.empty();
    }
    String raw = node.path("endDate").asText(null);
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Instant.parse(raw.trim()));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  /**
   * Token ids of the "Up" and "Down" outcomes, matched by outcome label. Falls back to positional
   * order (first = Up) when labels are missing.
   */
  public static Optional<UpDownTokens> upDownTokens(JsonNode market, ObjectMapper objectMapper) {
    if (market == null) {
      return Optional.empty();
    }
    List<String> tokenIds = stringArray(market.path("clobTokenIds"), objectMapper);
    if (tokenIds.size() < 2) {
      return Optional.empty();
    }
    List<String> outcomes = stringArray(market.path("outcomes"), objectMapper);
    String up = null;
    String down = null;
    for (int i = 0; i < outcomes.size() && i < tokenIds.size(); i++) {
      String label = outcomes.get(i) == null ? "" : outcomes.get(i).trim().toLowerCase(Locale.ROOT);
      if (label.equals("up")) {
        up = tokenIds.get(i);
      } else if (label.equals("down")) {
        down = tokenIds.get(i);
      }
    }
    if (outcomes.isEmpty()) {
      up = tokenIds.get(0);
      down = tokenIds.get(1);
    }
    if (isBlank(up) || isBlank(down)) {
      return Optional.empty();
    }
    return Optional.of(new UpDownTokens(up, down));
  }

  /**
   * First entry of {@code outcomePrices}, i.e. the settled price of the "Up" outcome.
   */
  public static Optional<Double> firstOutcomePrice(JsonNode market, ObjectMapper objectMapper) {
    if (market == null) {
      return Optional.empty();
    }
    List<String> prices = stringArray(market.path("outcomePrices"), objectMapper);
    if (prices.isEmpty()) {
      return Optional.empty();
    }
    try {
      double v = Double.parseDouble(prices.get(0).trim());
      return Double.isFinite(v) ? Optional.of(v) : Optional.empty();
    } catch (NumberFormatException | NullPointerException e) {
      return Optional.empty();
    }
  }

  public static List<String> stringArray(JsonNode node, ObjectMapper objectMapper) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return List.of();
    }
    JsonNode array = node;
    if (node.isTextual()) {
      try {
        array = objectMapper.readTree(node.asText());
      } catch (Exception e) {
        return List.of();
      }
    }
    if (array == null || !array.isArray()) {
      return List.of();
    }
    List<String> out = new ArrayList<>(array.size());
    for (JsonNode v : array) {
      out.add(v.isNull() ? null : v.asText());
    }
    return out;
  }

  private static void collect(JsonNode node, List<JsonNode> out) {
    if (node == null || node.isNull()) {
      return;
    }
    JsonNode markets = node.get("markets");
    if (markets != null && markets.isArray()) {
      markets.forEach(out::add);
    } else if (node.has("clobTokenIds") || node.has("question")) {
      out.add(node);
    }
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
