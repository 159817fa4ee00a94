package com.updownbot.hft.polymarket.http;

public record RetryPolicy(
    boolean enabled,
    int maxAttempts,
    long initialBackoffMillis,
    long maxBackoffMillis
) {

  public static RetryPolicy none() {
    return new RetryPolicy(false, 1, 0, 0);
  }

  public int attempts() {
    return enabled ? Math.max(1, maxAttempts) : 1;
  }

  /**
   * Backoff before attempt {@code attempt + 1}, doubling from {@code initialBackoffMillis}.
   */
  public long backoffMillis(int attempt) {
    if (initialBackoffMillis <= 0) {
      return 0;
    }
    long delay = initialBackoffMillis;
    for (int i = 1; i < attempt && delay < maxBackoffMillis; i++) {
      delay *= 2;
    }
    return Math.min(delay, Math.max(initialBackoffMillis, maxBackoffMillis));
  }
}
