package com.updownbot.hft.outcome;

public enum MarketOutcome {
  UP_WON,
  DOWN_WON,
  /** Market exists but has not settled (or is absent from the response). */
  UNRESOLVED,
  /** The lookup itself failed. */
  FETCH_ERROR;

  public boolean isSettled() {
    return this == UP_WON || this == DOWN_WON;
  }
}
