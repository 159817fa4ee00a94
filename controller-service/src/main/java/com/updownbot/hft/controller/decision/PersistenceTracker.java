package com.updownbot.hft.controller.decision;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-symbol persistence state. Owned by the decision loop and only touched from its thread.
 */
public class PersistenceTracker {

    private final Map<String, PersistenceState> stateBySymbol = new HashMap<>();

    /**
     * A raw proposal on the same side extends the run, a different side restarts it at one, and no
     * proposal clears it.
     */
    public static PersistenceState advance(PersistenceState previous, Side rawSide) {
        if (rawSide == null) {
            return PersistenceState.NONE;
        }
        if (previous != null && previous.side() == rawSide) {
            return new PersistenceState(rawSide, previous.consecutiveCount() + 1);
        }
        return new PersistenceState(rawSide, 1);
    }

    public PersistenceState current(String symbol) {
        return stateBySymbol.getOrDefault(symbol, PersistenceState.NONE);
    }

    public void store(String symbol, PersistenceState state) {
        stateBySymbol.put(symbol, state == null ? PersistenceState.NONE : state);
    }

    public void reset(String symbol) {
        stateBySymbol.remove(symbol);
    }

    public Map<String, PersistenceState> snapshot() {
        return Map.copyOf(stateBySymbol);
    }
}
