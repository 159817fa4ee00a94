package com.updownbot.hft.polymarket.gamma;

import com.fasterxml.jackson.databind.JsonNode;
import com.updownbot.hft.polymarket.http.HttpRequestFactory;
import com.updownbot.hft.polymarket.http.PolymarketHttpTransport;
import lombok.NonNull;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

public class PolymarketGammaClient {

  private final HttpRequestFactory requestFactory;
  private final PolymarketHttpTransport transport;
  private final Duration timeout;

  public PolymarketGammaClient(@NonNull URI baseUri, @NonNull PolymarketHttpTransport transport, @NonNull Duration timeout) {
    this.requestFactory = new HttpRequestFactory(Objects.requireNonNull(baseUri, "baseUri"));
    this.transport = Objects.requireNonNull(transport, "transport");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  public JsonNode events(Map<String, String> query) {
    return get("/events", query);
  }

  public JsonNode markets(Map<String, String> query) {
    return get("/markets", query);
  }

  public JsonNode eventsBySlug(String slug) {
    requireSlug(slug);
    return events(Map.of("slug", slug));
  }

  public JsonNode marketsBySlug(String slug) {
    requireSlug(slug);
    return markets(Map.of("slug", slug));
  }

  private JsonNode get(String path, Map<String, String> query) {
    HttpRequest request = requestFactory.request(path, query == null ? Map.of() : query)
        .GET()
        .timeout(timeout)
        .header("Accept", "application/json")
        .build();
    return transport.sendJson(request, JsonNode.class);
  }

  private static void requireSlug(String slug) {
    if (slug == null || slug.isBlank()) {
      throw new IllegalArgumentException("slug must not be blank");
    }
  }
}
