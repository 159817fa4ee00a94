package com.updownbot.hft.controller.shadow;

/**
 * Aggregate shadow performance. Averages cover settled proposals only; {@code unresolvable} counts
 * proposals closed without a settled outcome.
 */
public record ShadowStats(
        long totalProposals,
        long pending,
        long resolved,
        long unresolvable,
        long wins,
        long losses,
        double winRate,
        double avgEdge,
        double avgNetEdge,
        double avgProbability,
        double totalRealizedPnl,
        double avgRealizedPnl,
        long volFloorFiltered,
        long zClampFiltered
) {
    public static ShadowStats empty() {
        return new ShadowStats(0, 0, 0, 0, 0, 0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0, 0);
    }
}
