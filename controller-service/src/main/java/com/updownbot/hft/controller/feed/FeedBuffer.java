package com.updownbot.hft.controller.feed;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-symbol rolling buffer of trade prints, written by the feed threads and read by the decision loop.
 * Every mutation and every read of a symbol's history goes through {@link ConcurrentHashMap#compute},
 * so readers always see a consistent copy.
 */
public class FeedBuffer {

    private static final long BUCKET_MILLIS = 1_000L;

    private final long bufferMillis;
    private final long windowMillis;
    private final int minBuckets;

    private final Map<String, Deque<PriceTick>> historyBySymbol = new ConcurrentHashMap<>();

    public FeedBuffer(int bufferSeconds, int windowSeconds, int minBuckets) {
        if (windowSeconds <= 0 || bufferSeconds < windowSeconds) {
            throw new IllegalArgumentException("bufferSeconds must cover windowSeconds");
        }
        this.bufferMillis = bufferSeconds * 1_000L;
        this.windowMillis = windowSeconds * 1_000L;
        this.minBuckets = Math.max(2, minBuckets);
    }

    public void append(PriceTick tick, long nowMillis) {
        if (tick == null || tick.symbol() == null || !(tick.price() > 0) || !Double.isFinite(tick.price())) {
            return;
        }
        historyBySymbol.compute(tick.symbol(), (k, prev) -> {
            Deque<PriceTick> history = prev != null ? prev : new ArrayDeque<>();
            history.addLast(tick);
            trim(history, nowMillis);
            return history;
        });
    }

    public int tickCount(String symbol, long nowMillis) {
        return copy(symbol, nowMillis).size();
    }

    /**
     * Derives the reference price, the return over the window and the volatility of 1-second returns.
     */
    public FeatureSnapshot features(String symbol, long nowMillis) {
        List<PriceTick> ticks = copy(symbol, nowMillis);
        if (ticks.size() < 2) {
            return FeatureSnapshot.insufficient(symbol, ticks.size());
        }

        PriceTick latest = ticks.get(ticks.size() - 1);
        long windowStart = nowMillis - windowMillis;

        double basePrice = ticks.get(0).price();
        for (int i = ticks.size() - 1; i >= 0; i--) {
            if (ticks.get(i).timestampMillis() <= windowStart) {
                basePrice = ticks.get(i).price();
                break;
            }
        }
        double ret = latest.price() / basePrice - 1.0;

        TreeMap<Long, Double> buckets = new TreeMap<>();
        for (PriceTick t : ticks) {
            if (t.timestampMillis() >= windowStart) {
                buckets.put(Math.floorDiv(t.timestampMillis(), BUCKET_MILLIS), t.price());
            }
        }
        double vol = bucketVolatility(new ArrayList<>(buckets.values()));

        int bucketCount = buckets.size();
        boolean ok = bucketCount >= minBuckets;
        String reason = ok ? null : "need %d buckets, have %d".formatted(minBuckets, bucketCount);
        return new FeatureSnapshot(symbol, latest.price(), ret, vol, ok, bucketCount, ticks.size(), reason);
    }

    /**
     * Population standard deviation of consecutive bucket returns; zero with fewer than two buckets.
     */
    static double bucketVolatility(List<Double> bucketPrices) {
        if (bucketPrices.size() < 2) {
            return 0.0;
        }
        double[] returns = new double[bucketPrices.size() - 1];
        double sum = 0.0;
        for (int i = 1; i < bucketPrices.size(); i++) {
            returns[i - 1] = bucketPrices.get(i) / bucketPrices.get(i - 1) - 1.0;
            sum += returns[i - 1];
        }
        double mean = sum / returns.length;
        double variance = 0.0;
        for (double r : returns) {
            variance += (r - mean) * (r - mean);
        }
        return Math.sqrt(variance / returns.length);
    }

    private List<PriceTick> copy(String symbol, long nowMillis) {
        List<PriceTick> out = new ArrayList<>();
        historyBySymbol.computeIfPresent(symbol, (k, history) -> {
            trim(history, nowMillis);
            out.addAll(history);
            return history;
        });
        return out;
    }

    private void trim(Deque<PriceTick> history, long nowMillis) {
        long cutoff = nowMillis - bufferMillis;
        while (!history.isEmpty() && history.peekFirst().timestampMillis() < cutoff) {
            history.pollFirst();
        }
    }
}
