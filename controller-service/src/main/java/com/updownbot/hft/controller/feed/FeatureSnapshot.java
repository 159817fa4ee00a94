package com.updownbot.hft.controller.feed;

/**
 * Features derived from the trailing trade window of one symbol.
 * When {@code ok} is false the numeric fields are not reliable; with fewer than two ticks they are null.
 *
 * @param sampleCount number of populated 1-second buckets inside the window
 */
public record FeatureSnapshot(
        String symbol,
        Double referencePrice,
        Double return60s,
        Double vol60s,
        boolean ok,
        int sampleCount,
        int tickCount,
        String reason
) {

    public static FeatureSnapshot insufficient(String symbol, int tickCount) {
        return new FeatureSnapshot(symbol, null, null, null, false, 0, tickCount, "insufficient ticks");
    }
}
