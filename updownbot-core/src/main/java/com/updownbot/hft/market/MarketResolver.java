package com.updownbot.hft.market;

import java.time.Instant;
import java.util.Optional;

/**
 * Resolves the currently open Up/Down window for an asset together with its order books.
 */
public interface MarketResolver {

  /**
   * @return the open window for {@code symbol} at {@code now}, or empty when no such market exists
   * @throws RuntimeException on transport failures; callers treat these as a per-symbol soft failure
   */
  Optional<MarketWindowState> resolve(String symbol, Instant now);
}
