package com.updownbot.hft.market;

import com.updownbot.hft.polymarket.clob.TopOfBook;

/**
 * Top of book for one outcome of an Up/Down market.
 */
public record SideQuote(
    Double bid,
    Double ask,
    Double mid,
    Double askSize
) {

  public static SideQuote empty() {
    return new SideQuote(null, null, null, null);
  }

  public static SideQuote of(TopOfBook tob) {
    if (tob == null) {
      return empty();
    }
    return new SideQuote(tob.bestBid(), tob.bestAsk(), tob.mid(), tob.bestAskSize());
  }

  /**
   * Ask minus bid, or null when either side is missing.
   */
  public Double spread() {
    if (bid == null || ask == null) {
      return null;
    }
    return ask - bid;
  }
}
