package com.updownbot.hft.controller.feed;

import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * {@link FeedTransport} over {@code java.net.http.WebSocket}. Fragmented frames are reassembled
 * before reaching the listener.
 */
@Slf4j
public class JdkWebSocketFeedTransport implements FeedTransport {

    private final HttpClient httpClient;
    private final Duration connectTimeout;

    public JdkWebSocketFeedTransport(HttpClient httpClient, Duration connectTimeout) {
        this.httpClient = httpClient;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public CompletableFuture<Connection> connect(URI uri, Listener listener) {
        return httpClient.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(uri, new Adapter(listener))
                .thenApply(ws -> (Connection) () -> close(ws));
    }

    private static void close(WebSocket ws) {
        try {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye");
        } catch (RuntimeException e) {
            log.debug("close failed, aborting: {}", e.getMessage());
        }
        ws.abort();
    }

    private static final class Adapter implements WebSocket.Listener {

        private final Listener listener;
        private final StringBuilder buf = new StringBuilder();

        private Adapter(Listener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            listener.onOpen();
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buf.append(data);
            if (last) {
                String msg = buf.toString();
                buf.setLength(0);
                listener.onMessage(msg);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            listener.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(error);
        }
    }
}
