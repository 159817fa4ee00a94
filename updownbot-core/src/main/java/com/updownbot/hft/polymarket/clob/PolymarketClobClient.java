package com.updownbot.hft.polymarket.clob;

import com.fasterxml.jackson.databind.JsonNode;
import com.updownbot.hft.polymarket.http.HttpRequestFactory;
import com.updownbot.hft.polymarket.http.PolymarketHttpTransport;
import lombok.NonNull;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

public class PolymarketClobClient {

  private final HttpRequestFactory requestFactory;
  private final PolymarketHttpTransport transport;
  private final Duration timeout;

  public PolymarketClobClient(@NonNull URI baseUri, @NonNull PolymarketHttpTransport transport, @NonNull Duration timeout) {
    this.requestFactory = new HttpRequestFactory(Objects.requireNonNull(baseUri, "baseUri"));
    this.transport = Objects.requireNonNull(transport, "transport");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  public JsonNode getOrderBook(String tokenId) {
    if (tokenId == null || tokenId.isBlank()) {
      throw new IllegalArgumentException("tokenId must not be blank");
    }
    HttpRequest request = requestFactory.request("/book", Map.of("token_id", tokenId))
        .GET()
        .timeout(timeout)
        .header("Accept", "application/json")
        .build();
    return transport.sendJson(request, JsonNode.class);
  }

  public static boolean isNotFoundError(JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull()) {
      return false;
    }
    String err = node.path("error").asText(null);
    return err != null && err.toLowerCase().contains("no orderbook exists");
  }
}
