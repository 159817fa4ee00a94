package com.updownbot.hft.polymarket.clob;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Best bid/ask of one outcome token. Prices are null when that side of the book is empty.
 */
public record TopOfBook(
    Double bestBid,
    Double bestAsk,
    Double bestBidSize,
    Double bestAskSize
) {

  public static TopOfBook empty() {
    return new TopOfBook(null, null, null, null);
  }

  /**
   * Reads a CLOB {@code /book} payload. Level ordering differs between endpoints, so the best
   * level is picked by price rather than by position.
   */
  public static TopOfBook fromBook(JsonNode book) {
    if (book == null || book.isMissingNode() || book.isNull()) {
      return empty();
    }
    double[] bid = best(book.path("bids"), true);
    double[] ask = best(book.path("asks"), false);
    return new TopOfBook(
        bid == null ? null : bid[0],
        ask == null ? null : ask[0],
        bid == null ? null : bid[1],
        ask == null ? null : ask[1]
    );
  }

  public Double mid() {
    if (bestBid == null || bestAsk == null) {
      return null;
    }
    return (bestBid + bestAsk) / 2.0;
  }

  public Double spread() {
    if (bestBid == null || bestAsk == null) {
      return null;
    }
    return bestAsk - bestBid;
  }

  private static double[] best(JsonNode levels, boolean highest) {
    if (levels == null || !levels.isArray()) {
      return null;
    }
    double[] best = null;
    for (JsonNode level : levels) {
      double price = level.path("price").asDouble(Double.NaN);
      double size = level.path("size").asDouble(0);
      if (Double.isNaN(price) || price <= 0 || size <= 0) {
        continue;
      }
      if (best == null || (highest ? price > best[0] : price < best[0])) {
        best = new double[]{price, size};
      } else if (price == best[0]) {
        best[1] += size;
      }
    }
    return best;
  }
}
