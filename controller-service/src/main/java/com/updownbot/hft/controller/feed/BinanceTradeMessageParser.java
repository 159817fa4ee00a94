package com.updownbot.hft.controller.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Parses combined-stream trade messages: {@code {"stream":"btcusdt@trade","data":{"s":"BTCUSDT","p":"97000.1","T":1700000000000}}}.
 */
@Slf4j
public class BinanceTradeMessageParser {

    private final ObjectMapper objectMapper;
    private final Map<String, String> symbolByStream;

    /**
     * @param streamBySymbol tracked symbol to lower-case exchange symbol, e.g. {@code BTC -> btcusdt}
     */
    public BinanceTradeMessageParser(ObjectMapper objectMapper, Map<String, String> streamBySymbol) {
        this.objectMapper = objectMapper;
        this.symbolByStream = new HashMap<>();
        streamBySymbol.forEach((symbol, stream) -> symbolByStream.put(stream.toLowerCase(Locale.ROOT), symbol));
    }

    /**
     * @param receivedAtMillis used when the message carries no trade time
     * @return the tick, or empty for unknown symbols and malformed messages
     */
    public Optional<PriceTick> parse(String text, long receivedAtMillis) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("dropping malformed feed message: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        JsonNode data = root == null ? null : root.get("data");
        if (data == null || !data.hasNonNull("s") || !data.hasNonNull("p")) {
            return Optional.empty();
        }
        String symbol = symbolByStream.get(data.get("s").asText().toLowerCase(Locale.ROOT));
        if (symbol == null) {
            return Optional.empty();
        }
        double price;
        try {
            price = Double.parseDouble(data.get("p").asText());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (!Double.isFinite(price) || price <= 0) {
            return Optional.empty();
        }
        long ts = data.path("T").asLong(0L);
        return Optional.of(new PriceTick(symbol, price, ts > 0 ? ts : receivedAtMillis));
    }
}
