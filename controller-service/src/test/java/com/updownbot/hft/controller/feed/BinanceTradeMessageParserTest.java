package com.updownbot.hft.controller.feed;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BinanceTradeMessageParserTest {

    private final BinanceTradeMessageParser parser =
            new BinanceTradeMessageParser(new ObjectMapper(), Map.of("BTC", "btcusdt", "ETH", "ethusdt"));

    @Test
    void parsesCombinedStreamTrade() {
        String msg = "{\"stream\":\"btcusdt@trade\",\"data\":{\"e\":\"trade\",\"s\":\"BTCUSDT\",\"p\":\"97000.10\",\"q\":\"0.01\",\"T\":1771925400123}}";

        assertThat(parser.parse(msg, 5L)).contains(new PriceTick("BTC", 97000.10, 1771925400123L));
    }

    @Test
    void usesReceiveTimeWhenTradeTimeMissing() {
        String msg = "{\"data\":{\"s\":\"ETHUSDT\",\"p\":\"2500\"}}";

        assertThat(parser.parse(msg, 42L)).contains(new PriceTick("ETH", 2500.0, 42L));
    }

    @Test
    void dropsUnknownMalformedAndNonPositive() {
        assertThat(parser.parse("{\"data\":{\"s\":\"DOGEUSDT\",\"p\":\"0.1\"}}", 1L)).isEmpty();
        assertThat(parser.parse("not json", 1L)).isEmpty();
        assertThat(parser.parse("{\"result\":null,\"id\":1}", 1L)).isEmpty();
        assertThat(parser.parse("{\"data\":{\"s\":\"BTCUSDT\",\"p\":\"abc\"}}", 1L)).isEmpty();
        assertThat(parser.parse("{\"data\":{\"s\":\"BTCUSDT\",\"p\":\"-1\"}}", 1L)).isEmpty();
    }
}
