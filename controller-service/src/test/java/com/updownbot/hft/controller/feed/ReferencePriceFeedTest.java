package com.updownbot.hft.controller.feed;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ReferencePriceFeedTest {

    private static final long T0 = 1_771_925_400_000L;
    private static final String TRADE = "{\"stream\":\"btcusdt@trade\",\"data\":{\"s\":\"BTCUSDT\",\"p\":\"97000\",\"T\":" + T0 + "}}";

    @Mock
    private ScheduledExecutorService scheduler;

    private final List<Runnable> scheduled = new ArrayList<>();
    private final List<Long> delays = new ArrayList<>();
    private final MutableClock clock = new MutableClock(T0);
    private final FakeTransport transport = new FakeTransport();
    private final FeedBuffer buffer = new FeedBuffer(120, 60, 10);
    private ReferencePriceFeed feed;

    @BeforeEach
    void setUp() {
        lenient().when(scheduler.schedule(any(Runnable.class), anyLong(), eq(TimeUnit.MILLISECONDS))).thenAnswer(inv -> {
            scheduled.add(inv.getArgument(0));
            delays.add(inv.getArgument(1));
            return mock(ScheduledFuture.class);
        });
        Map<String, String> streams = Map.of("BTC", "btcusdt");
        feed = new ReferencePriceFeed(
                buffer,
                transport,
                new BinanceTradeMessageParser(new ObjectMapper(), streams),
                scheduler,
                clock,
                "wss://stream.test/stream",
                streams,
                new ReconnectBackoff(1_000, 30_000),
                30_000,
                60_000
        );
    }

    @Test
    void connectsAndBuffersTicks() {
        feed.start();

        assertThat(transport.uris).containsExactly(URI.create("wss://stream.test/stream?streams=btcusdt@trade"));
        verify(scheduler).scheduleAtFixedRate(any(Runnable.class), eq(30_000L), eq(30_000L), eq(TimeUnit.MILLISECONDS));

        transport.last().onOpen();
        transport.last().onMessage(TRADE);

        assertThat(feed.isConnected()).isTrue();
        assertThat(feed.lastMessageAtMillis()).isEqualTo(T0);
        assertThat(buffer.tickCount("BTC", T0)).isEqualTo(1);
    }

    @Test
    void reconnectsWithDoublingBackoffAndResetsOnOpen() {
        feed.start();
        FeedTransport.Listener first = transport.last();
        first.onOpen();
        first.onClosed(1006, "abnormal");

        assertThat(feed.isConnected()).isFalse();
        assertThat(feed.isReconnectPending()).isTrue();
        assertThat(delays).containsExactly(1_000L);

        scheduled.get(0).run();
        assertThat(transport.listeners).hasSize(2);
        assertThat(feed.isReconnectPending()).isFalse();

        transport.last().onError(new IOException("reset"));
        assertThat(delays).containsExactly(1_000L, 2_000L);

        scheduled.get(1).run();
        transport.last().onOpen();
        transport.last().onClosed(1000, "");
        assertThat(delays).containsExactly(1_000L, 2_000L, 1_000L);
    }

    @Test
    void ignoresCallbacksFromSupersededConnections() {
        feed.start();
        FeedTransport.Listener first = transport.last();
        first.onClosed(1006, "");
        scheduled.get(0).run();

        first.onMessage(TRADE);
        first.onOpen();
        first.onClosed(1006, "");

        assertThat(buffer.tickCount("BTC", T0)).isZero();
        assertThat(feed.isConnected()).isFalse();
        assertThat(delays).hasSize(1);
    }

    @Test
    void handshakeFailureSchedulesReconnect() {
        transport.failNext = true;

        feed.start();

        assertThat(feed.isConnected()).isFalse();
        assertThat(delays).containsExactly(1_000L);
    }

    @Test
    void healthCheckForcesReconnectWhenStreamGoesQuiet() {
        feed.start();
        transport.last().onOpen();

        clock.advance(30_000);
        feed.healthCheck();
        assertThat(delays).isEmpty();

        clock.advance(31_000);
        feed.healthCheck();

        assertThat(feed.isConnected()).isFalse();
        assertThat(transport.closed).isEqualTo(1);
        assertThat(delays).containsExactly(1_000L);

        transport.listeners.get(0).onClosed(1000, "closed by client");
        assertThat(delays).hasSize(1);
    }

    @Test
    void healthCheckReconnectsWhenDisconnectedWithNothingPending() {
        feed.start();

        feed.healthCheck();

        assertThat(delays).containsExactly(1_000L);
        feed.healthCheck();
        assertThat(delays).hasSize(1);
    }

    @Test
    void stopClosesConnectionAndSuppressesReconnect() {
        feed.start();
        FeedTransport.Listener listener = transport.last();
        listener.onOpen();

        feed.stop();
        listener.onClosed(1000, "");

        assertThat(transport.closed).isEqualTo(1);
        assertThat(feed.isConnected()).isFalse();
        assertThat(delays).isEmpty();
    }

    private static final class FakeTransport implements FeedTransport {

        final List<URI> uris = new ArrayList<>();
        final List<Listener> listeners = new ArrayList<>();
        int closed;
        boolean failNext;

        @Override
        public CompletableFuture<Connection> connect(URI uri, Listener listener) {
            uris.add(uri);
            listeners.add(listener);
            if (failNext) {
                failNext = false;
                return CompletableFuture.failedFuture(new IOException("connection refused"));
            }
            return CompletableFuture.completedFuture(() -> closed++);
        }

        Listener last() {
            return listeners.get(listeners.size() - 1);
        }
    }

    private static final class MutableClock extends Clock {

        private long millis;

        MutableClock(long millis) {
            this.millis = millis;
        }

        void advance(long deltaMillis) {
            millis += deltaMillis;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }

        @Override
        public long millis() {
            return millis;
        }
    }
}
