package com.updownbot.hft.controller.feed;

/**
 * Exponential reconnect delay: starts at the initial delay, doubles after each scheduled attempt,
 * and is capped at the maximum. Not thread-safe; guarded by the owning feed.
 */
public class ReconnectBackoff {

    private final long initialDelayMillis;
    private final long maxDelayMillis;
    private long currentDelayMillis;

    public ReconnectBackoff(long initialDelayMillis, long maxDelayMillis) {
        if (initialDelayMillis <= 0 || maxDelayMillis < initialDelayMillis) {
            throw new IllegalArgumentException("invalid backoff: initial=%d max=%d".formatted(initialDelayMillis, maxDelayMillis));
        }
        this.initialDelayMillis = initialDelayMillis;
        this.maxDelayMillis = maxDelayMillis;
        this.currentDelayMillis = initialDelayMillis;
    }

    public long currentDelayMillis() {
        return currentDelayMillis;
    }

    public void escalate() {
        currentDelayMillis = Math.min(currentDelayMillis * 2, maxDelayMillis);
    }

    public void reset() {
        currentDelayMillis = initialDelayMillis;
    }
}
