package com.updownbot.hft.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.updownbot.hft.polymarket.clob.PolymarketClobClient;
import com.updownbot.hft.polymarket.clob.TopOfBook;
import com.updownbot.hft.polymarket.discovery.PolymarketMarketParser;
import com.updownbot.hft.polymarket.discovery.UpDownTokens;
import com.updownbot.hft.polymarket.gamma.PolymarketGammaClient;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves {@code {asset}-updown-15m-{slotStart}} markets: token ids and end time come from
 * Gamma {@code /events?slug=} (cached per slug), books from CLOB {@code /book}.
 */
@Slf4j
@RequiredArgsConstructor
public class UpDown15mMarketResolver implements MarketResolver {

  private static final int MAX_CACHED_SLUGS = 64;

  private final @NonNull PolymarketGammaClient gammaClient;
  private final @NonNull PolymarketClobClient clobClient;
  private final @NonNull ObjectMapper objectMapper;

  private final Map<String, WindowTokens> tokensBySlug = new ConcurrentHashMap<>();

  @Override
  public Optional<MarketWindowState> resolve(String symbol, Instant now) {
    Instant start = MarketWindowState.slotStart(now);
    String slug = MarketWindowState.slugFor(symbol, start);

    WindowTokens tokens = tokensBySlug.get(slug);
    if (tokens == null) {
      tokens = lookupTokens(slug, start).orElse(null);
      if (tokens == null) {
        log.debug("no up/down market for {} ({})", symbol, slug);
        return Optional.empty();
      }
      if (tokensBySlug.size() >= MAX_CACHED_SLUGS) {
        tokensBySlug.clear();
      }
      tokensBySlug.put(slug, tokens);
    }

    SideQuote up = SideQuote.of(book(tokens.tokens().upTokenId()));
    SideQuote down = SideQuote.of(book(tokens.tokens().downTokenId()));
    return Optional.of(MarketWindowState.of(symbol, slug, up, down, start, tokens.windowEnd()));
  }

  private Optional<WindowTokens> lookupTokens(String slug, Instant slotStart) {
    JsonNode root = gammaClient.eventsBySlug(slug);
    JsonNode event = pickEvent(root, slug);
    if (event == null || event.path("closed").asBoolean(false)) {
      return Optional.empty();
    }
    List<JsonNode> markets = PolymarketMarketParser.extractMarkets(event);
    for (JsonNode market : markets) {
      Optional<UpDownTokens> tokens = PolymarketMarketParser.upDownTokens(market, objectMapper);
      if (tokens.isPresent()) {
        Instant end = PolymarketMarketParser.endTime(market)
            .or(() -> PolymarketMarketParser.endTime(event))
            .orElse(slotStart.plus(MarketWindowState.WINDOW));
        return Optional.of(new WindowTokens(tokens.get(), end));
      }
    }
    return Optional.empty();
  }

  private TopOfBook book(String tokenId) {
    JsonNode node = clobClient.getOrderBook(tokenId);
    if (PolymarketClobClient.isNotFoundError(node)) {
      return TopOfBook.empty();
    }
    return TopOfBook.fromBook(node);
  }

  private static JsonNode pickEvent(JsonNode root, String slug) {
    if (root == null || root.isNull()) {
      return null;
    }
    if (!root.isArray()) {
      return root;
    }
    if (root.isEmpty()) {
      return null;
    }
    for (JsonNode n : root) {
      if (slug.equals(PolymarketMarketParser.slug(n))) {
        return n;
      }
    }
    return root.get(0);
  }

  private record WindowTokens(UpDownTokens tokens, Instant windowEnd) {
  }
}
