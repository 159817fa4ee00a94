package com.updownbot.hft.controller.io;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded per-symbol history; the oldest entry is evicted first. Decision-loop thread only.
 */
public class DecisionRingBuffer {

    private final int capacity;
    private final Map<String, Deque<RingEntry>> entriesBySymbol = new LinkedHashMap<>();

    public DecisionRingBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    public void add(String symbol, RingEntry entry) {
        Deque<RingEntry> entries = entriesBySymbol.computeIfAbsent(symbol, k -> new ArrayDeque<>());
        entries.addLast(entry);
        while (entries.size() > capacity) {
            entries.pollFirst();
        }
    }

    public int size(String symbol) {
        Deque<RingEntry> entries = entriesBySymbol.get(symbol);
        return entries == null ? 0 : entries.size();
    }

    public Map<String, List<RingEntry>> snapshot() {
        Map<String, List<RingEntry>> out = new LinkedHashMap<>();
        entriesBySymbol.forEach((symbol, entries) -> out.put(symbol, List.copyOf(entries)));
        return out;
    }
}
