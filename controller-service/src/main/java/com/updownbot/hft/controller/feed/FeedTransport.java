package com.updownbot.hft.controller.feed;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Text-frame streaming connection to the reference exchange.
 */
public interface FeedTransport {

    /**
     * Opens a connection. The future completes once the handshake finishes, or exceptionally when it fails.
     */
    CompletableFuture<Connection> connect(URI uri, Listener listener);

    interface Connection {
        void close();
    }

    interface Listener {
        void onOpen();

        /**
         * Called with complete text messages only.
         */
        void onMessage(String text);

        void onClosed(int statusCode, String reason);

        void onError(Throwable error);
    }
}
