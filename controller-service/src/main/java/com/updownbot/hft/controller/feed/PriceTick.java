package com.updownbot.hft.controller.feed;

/**
 * One exchange trade print.
 *
 * @param symbol          tracked symbol, e.g. {@code BTC}
 * @param timestampMillis exchange trade time in epoch millis
 */
public record PriceTick(String symbol, double price, long timestampMillis) {
}
