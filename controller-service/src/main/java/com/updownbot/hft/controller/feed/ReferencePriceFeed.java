package com.updownbot.hft.controller.feed;

import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Owns the exchange trade stream: pushes ticks into the {@link FeedBuffer}, reconnects with
 * exponential backoff, and forces a reconnect when the stream goes quiet.
 * Connection state changes are synchronized on this instance; callbacks from superseded
 * connections are ignored by generation number.
 */
@Slf4j
public class ReferencePriceFeed {

    private final FeedBuffer buffer;
    private final FeedTransport transport;
    private final BinanceTradeMessageParser parser;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final URI streamUri;
    private final ReconnectBackoff backoff;
    private final long healthCheckIntervalMillis;
    private final long staleThresholdMillis;

    private volatile boolean connected;
    private volatile long lastMessageAtMillis;

    private FeedTransport.Connection connection;
    private ScheduledFuture<?> reconnectTask;
    private ScheduledFuture<?> healthCheckTask;
    private volatile long generation;
    private boolean started;

    public ReferencePriceFeed(
            FeedBuffer buffer,
            FeedTransport transport,
            BinanceTradeMessageParser parser,
            ScheduledExecutorService scheduler,
            Clock clock,
            String streamUrl,
            Map<String, String> streamBySymbol,
            ReconnectBackoff backoff,
            long healthCheckIntervalMillis,
            long staleThresholdMillis
    ) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.streamUri = streamUri(streamUrl, streamBySymbol);
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.healthCheckIntervalMillis = healthCheckIntervalMillis;
        this.staleThresholdMillis = staleThresholdMillis;
    }

    static URI streamUri(String streamUrl, Map<String, String> streamBySymbol) {
        String streams = streamBySymbol.values().stream()
                .map(s -> s + "@trade")
                .collect(Collectors.joining("/"));
        return URI.create(streamUrl + "?streams=" + streams);
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        log.info("reference feed connecting to {}", streamUri);
        connect();
        healthCheckTask = scheduler.scheduleAtFixedRate(this::safeHealthCheck,
                healthCheckIntervalMillis, healthCheckIntervalMillis, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (!started) {
            return;
        }
        started = false;
        cancel(healthCheckTask);
        healthCheckTask = null;
        cancel(reconnectTask);
        reconnectTask = null;
        destroyConnection();
        log.info("reference feed stopped");
    }

    public boolean isConnected() {
        return connected;
    }

    public long lastMessageAtMillis() {
        return lastMessageAtMillis;
    }

    public synchronized boolean isReconnectPending() {
        return reconnectTask != null;
    }

    synchronized void connect() {
        if (!started) {
            return;
        }
        destroyConnection();
        long gen = ++generation;
        try {
            transport.connect(streamUri, new GenerationListener(gen))
                    .whenComplete((conn, err) -> onConnectCompleted(gen, conn, err));
        } catch (RuntimeException e) {
            log.error("reference feed connect failed: {}", e.getMessage());
            scheduleReconnect();
        }
    }

    private synchronized void onConnectCompleted(long gen, FeedTransport.Connection conn, Throwable err) {
        if (err != null) {
            if (gen == generation) {
                log.warn("reference feed handshake failed: {}", err.getMessage());
                connected = false;
                scheduleReconnect();
            }
            return;
        }
        if (gen != generation || !started) {
            conn.close();
            return;
        }
        connection = conn;
    }

    private synchronized void onOpen(long gen) {
        if (gen != generation) {
            return;
        }
        connected = true;
        backoff.reset();
        lastMessageAtMillis = clock.millis();
        log.info("reference feed connected");
    }

    private void onMessage(long gen, String text) {
        if (gen != generation) {
            return;
        }
        long now = clock.millis();
        lastMessageAtMillis = now;
        parser.parse(text, now).ifPresent(tick -> buffer.append(tick, now));
    }

    private synchronized void onDisconnected(long gen, String cause) {
        if (gen != generation) {
            return;
        }
        connected = false;
        connection = null;
        log.warn("reference feed disconnected ({}), reconnecting in {}ms", cause, backoff.currentDelayMillis());
        scheduleReconnect();
    }

    synchronized void scheduleReconnect() {
        if (!started || reconnectTask != null) {
            return;
        }
        long delay = backoff.currentDelayMillis();
        reconnectTask = scheduler.schedule(this::reconnect, delay, TimeUnit.MILLISECONDS);
    }

    private synchronized void reconnect() {
        reconnectTask = null;
        backoff.escalate();
        connect();
    }

    synchronized void healthCheck() {
        if (!started) {
            return;
        }
        long sinceLast = clock.millis() - lastMessageAtMillis;
        if (lastMessageAtMillis > 0 && sinceLast > staleThresholdMillis) {
            log.warn("reference feed stale: no data for {}s, forcing reconnect", sinceLast / 1000);
            destroyConnection();
            generation++;
            lastMessageAtMillis = 0;
            backoff.reset();
            scheduleReconnect();
        } else if (!connected && reconnectTask == null) {
            log.warn("reference feed health check: not connected and no reconnect scheduled, forcing reconnect");
            backoff.reset();
            scheduleReconnect();
        }
    }

    private void safeHealthCheck() {
        try {
            healthCheck();
        } catch (Exception e) {
            log.error("reference feed health check failed", e);
        }
    }

    private void destroyConnection() {
        FeedTransport.Connection c = connection;
        connection = null;
        connected = false;
        if (c != null) {
            try {
                c.close();
            } catch (RuntimeException e) {
                log.debug("closing feed connection failed: {}", e.getMessage());
            }
        }
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    private final class GenerationListener implements FeedTransport.Listener {

        private final long gen;

        private GenerationListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onOpen() {
            ReferencePriceFeed.this.onOpen(gen);
        }

        @Override
        public void onMessage(String text) {
            ReferencePriceFeed.this.onMessage(gen, text);
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            onDisconnected(gen, "close " + statusCode + (reason == null || reason.isBlank() ? "" : " " + reason));
        }

        @Override
        public void onError(Throwable error) {
            onDisconnected(gen, "error " + error.getMessage());
        }
    }
}
