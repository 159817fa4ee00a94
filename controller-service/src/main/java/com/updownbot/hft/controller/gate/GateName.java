package com.updownbot.hft.controller.gate;

/**
 * Hard gates in evaluation order.
 */
public enum GateName {
    SANITY,
    SPREAD,
    DEPTH,
    TIME_REMAINING,
    CEX_FEED
}
