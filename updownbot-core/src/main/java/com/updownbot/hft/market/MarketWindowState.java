package com.updownbot.hft.market;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Book state of the currently open window of one asset's Up/Down market.
 *
 * @param sanitySum {@code upMid + downMid}; null when either mid is unknown
 */
public record MarketWindowState(
    String symbol,
    String slug,
    SideQuote up,
    SideQuote down,
    Double sanitySum,
    Instant windowStart,
    Instant windowEnd
) {

  public static final Duration WINDOW = Duration.ofMinutes(15);

  public MarketWindowState {
    if (up == null) {
      up = SideQuote.empty();
    }
    if (down == null) {
      down = SideQuote.empty();
    }
  }

  public static MarketWindowState of(String symbol, String slug, SideQuote up, SideQuote down, Instant windowStart, Instant windowEnd) {
    Double sum = null;
    if (up != null && down != null && up.mid() != null && down.mid() != null) {
      sum = up.mid() + down.mid();
    }
    return new MarketWindowState(symbol, slug, up, down, sum, windowStart, windowEnd);
  }

  /**
   * Seconds until the window closes, floored at zero. Unknown end counts as zero.
   */
  public double secondsRemaining(Instant now) {
    if (windowEnd == null || now == null) {
      return 0.0;
    }
    double s = (windowEnd.toEpochMilli() - now.toEpochMilli()) / 1000.0;
    return Math.max(0.0, s);
  }

  /**
   * Start of the 15 minute slot containing {@code now}; slot boundaries are multiples of 900 epoch seconds.
   */
  public static Instant slotStart(Instant now) {
    long sec = now.getEpochSecond();
    return Instant.ofEpochSecond((sec / WINDOW.toSeconds()) * WINDOW.toSeconds());
  }

  public static String slugFor(String symbol, Instant slotStart) {
    return symbol.toLowerCase(Locale.ROOT) + "-updown-15m-" + slotStart.getEpochSecond();
  }
}
