package com.updownbot.hft.polymarket.discovery;

public record UpDownTokens(String upTokenId, String downTokenId) {
}
